package com.flamingo.ai.nexuschat.service.extraction;

import com.flamingo.ai.nexuschat.config.NexusConfig;
import com.flamingo.ai.nexuschat.service.model.GenerativeModelClient;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Produces visual descriptions of images through the generative model. */
@Service
@RequiredArgsConstructor
@Slf4j
public class VisionAnalysisService {

  static final String PROMPT_TEMPLATE =
      """
      You are an advanced AI vision assistant. Please analyze this image and provide:

      1. **Main Description**: What do you see in this image?
      2. **Objects/Elements**: List the key objects, people, or elements present
      3. **Scene/Setting**: Describe the environment or setting
      4. **Colors & Composition**: Notable colors, lighting, and visual composition
      5. **Text Content**: Any text visible in the image (if any)
      6. **Additional Insights**: Interesting details, mood, or context

      User's specific request: %s

      Please be detailed, accurate, and helpful in your analysis.""";

  private final GenerativeModelClient modelClient;
  private final NexusConfig nexusConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Describes an image. Never throws: transport and model failures become a failed result.
   *
   * @param imageBytes raw image bytes
   * @param mimeType MIME type of the image
   * @param instruction caller instruction, or null/blank for the default
   */
  @Timed(value = "vision.analyze", description = "Time to describe an image")
  public VisionResult describe(byte[] imageBytes, String mimeType, String instruction) {
    String effective = resolveInstruction(instruction);
    try {
      String description = modelClient.generate(buildPrompt(effective), imageBytes, mimeType);
      if (description == null || description.isBlank()) {
        log.warn("Vision model returned an empty description");
        meterRegistry.counter("vision.analysis.failed").increment();
        return VisionResult.failure("empty response from vision model", effective);
      }
      meterRegistry.counter("vision.analysis.succeeded").increment();
      return VisionResult.success(description, effective);
    } catch (Exception e) {
      log.warn("Vision analysis failed: {}", e.getMessage());
      meterRegistry.counter("vision.analysis.failed").increment();
      return VisionResult.failure(String.valueOf(e.getMessage()), effective);
    }
  }

  /** Returns the caller instruction, or the configured default when none was given. */
  public String resolveInstruction(String instruction) {
    if (instruction == null || instruction.isBlank()) {
      return nexusConfig.getVision().getDefaultInstruction();
    }
    return instruction.trim();
  }

  static String buildPrompt(String instruction) {
    return PROMPT_TEMPLATE.formatted(instruction);
  }
}
