package com.ospicorp.recordsapi.records;

/**
 * Client input the controller refuses before touching storage. Rendered as {@code 400} with the
 * numeric error code and a link to its documentation.
 */
public class InvalidParameterException extends RuntimeException {

  static final int INVALID_DATE = 2001;
  static final int INVALID_DATA = 2002;

  private static final String ERROR_DOCS_BASE = "https://developers.company.com/docs/errors/";

  private final int errorCode;

  public InvalidParameterException(String message, int errorCode) {
    super(message);
    this.errorCode = errorCode;
  }

  public int errorCode() {
    return errorCode;
  }

  public String moreInfo() {
    return ERROR_DOCS_BASE + errorCode;
  }
}
