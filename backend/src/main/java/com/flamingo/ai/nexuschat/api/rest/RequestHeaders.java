package com.flamingo.ai.nexuschat.api.rest;

/** Header names shared by the REST controllers. */
public final class RequestHeaders {

  /** Opaque identifier of the calling user, set by the authenticating front end. */
  public static final String USER_ID = "X-User-Id";

  private RequestHeaders() {}
}
