package com.flamingo.ai.nexuschat.exception;

/** Exception thrown when an upload cannot be accepted. */
public class UnsupportedFileTypeException extends RuntimeException {

  private final String fileName;
  private final String userMessage;

  public UnsupportedFileTypeException(String fileName) {
    super("Unsupported file type: " + fileName);
    this.fileName = fileName;
    this.userMessage = "File type not allowed";
  }

  public UnsupportedFileTypeException(String fileName, String message, String userMessage) {
    super(message);
    this.fileName = fileName;
    this.userMessage = userMessage;
  }

  public String getFileName() {
    return fileName;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
