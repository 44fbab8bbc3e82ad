package com.flamingo.ai.nexuschat.service.responder;

/** Produces the assistant's reply to a question. */
public interface Responder {

  /**
   * Sends the question with its context to the model.
   *
   * <p>Never throws. Model failures are returned as a fixed user-facing sentence.
   *
   * @param question the user's question, or a fully composed file-grounded prompt
   * @param context prior conversation context, may be empty
   * @return the reply text
   */
  String respond(String question, String context);
}
