package com.flamingo.ai.nexuschat.config;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for ingestion, context composition and answering. */
@Configuration
@ConfigurationProperties(prefix = "nexus")
@Getter
@Setter
public class NexusConfig {

  private Upload upload = new Upload();
  private Context context = new Context();
  private Responder responder = new Responder();
  private TempFiles tempFiles = new TempFiles();
  private Ocr ocr = new Ocr();
  private Vision vision = new Vision();
  private TextAnalysis textAnalysis = new TextAnalysis();

  @Getter
  @Setter
  public static class Upload {
    private Set<String> allowedExtensions =
        new LinkedHashSet<>(List.of("txt", "pdf", "png", "jpg", "jpeg", "gif", "webp"));

    /** Length of the extracted-text preview returned by an upload. */
    private int textPreviewChars = 500;

    /** Length of the vision preview returned by an upload. */
    private int visionPreviewChars = 300;
  }

  @Getter
  @Setter
  public static class Context {
    private int textFragmentChars = 2000;
    private int visionFragmentChars = 1000;
    private int historyWindow = 5;
  }

  @Getter
  @Setter
  public static class Responder {
    /** Length of the raw diagnostic kept in the generic failure sentence. */
    private int diagnosticChars = 100;
  }

  @Getter
  @Setter
  public static class TempFiles {
    private int deleteMaxAttempts = 5;
    private Duration deleteInitialDelay = Duration.ofMillis(100);
    private double deleteBackoffMultiplier = 2.0;
  }

  @Getter
  @Setter
  public static class Ocr {
    /** Tesseract tessdata directory; empty uses the TESSDATA_PREFIX environment variable. */
    private String datapath = "";

    private String language = "eng";
  }

  @Getter
  @Setter
  public static class Vision {
    private String defaultInstruction = "Describe what you see in this image";
  }

  @Getter
  @Setter
  public static class TextAnalysis {
    /** Input cut applied before the extracted text is sent for summarisation. */
    private int maxInputChars = 2000;
  }
}
