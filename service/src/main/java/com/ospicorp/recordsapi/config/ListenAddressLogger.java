package com.ospicorp.recordsapi.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

@Component
public class ListenAddressLogger implements ApplicationListener<WebServerInitializedEvent> {

  private static final Logger log = LoggerFactory.getLogger(ListenAddressLogger.class);

  @Override
  public void onApplicationEvent(WebServerInitializedEvent event) {
    String host = event.getApplicationContext().getEnvironment().getProperty("server.address");
    ListenAddress address = new ListenAddress(host, event.getWebServer().getPort());
    log.info("Records API listening on {}", address);
  }
}
