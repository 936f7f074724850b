package com.ospicorp.recordsapi.records;

/**
 * Raised when the record store cannot complete a read or write.
 */
public class StorageException extends RuntimeException {

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
