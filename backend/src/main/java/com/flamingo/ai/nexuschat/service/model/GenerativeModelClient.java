package com.flamingo.ai.nexuschat.service.model;

/**
 * Client for the generative model.
 *
 * <p>Both operations block and may throw any runtime exception raised by the transport or the
 * provider. Callers decide how failures are surfaced.
 */
public interface GenerativeModelClient {

  /**
   * Sends a flattened text prompt.
   *
   * @param prompt the full prompt
   * @return the model's reply text, possibly empty
   */
  String generate(String prompt);

  /**
   * Sends an instruction together with one image.
   *
   * @param instruction text part of the request
   * @param imageBytes raw image bytes
   * @param mimeType MIME type of the image
   * @return the model's reply text, possibly empty
   */
  String generate(String instruction, byte[] imageBytes, String mimeType);
}
