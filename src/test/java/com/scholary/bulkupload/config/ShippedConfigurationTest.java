package com.scholary.bulkupload.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.bulkupload.file.SizedUploadFile;
import com.scholary.bulkupload.strategy.StrategyProperties;
import com.scholary.bulkupload.strategy.StrategySelector;
import com.scholary.bulkupload.strategy.UploadStrategy;
import com.scholary.bulkupload.validation.FileValidator;
import com.scholary.bulkupload.validation.ValidationProperties;
import com.scholary.bulkupload.validation.ValidationResult;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

/** Binds the packaged application.yml and runs files through the configured limits. */
class ShippedConfigurationTest {

  private static final long MIB = 1024 * 1024;

  private ValidationProperties validation;
  private StrategyProperties strategy;

  @BeforeEach
  void setUp() throws IOException {
    List<PropertySource<?>> sources =
        new YamlPropertySourceLoader()
            .load("application", new ClassPathResource("application.yml"));
    Binder binder = new Binder(ConfigurationPropertySources.from(sources));
    validation = binder.bind("upload.validation", ValidationProperties.class).get();
    strategy = binder.bind("upload.strategy", StrategyProperties.class).get();
  }

  @Test
  void maxFileSize_shouldLeaveRoomAboveTheStreamingThreshold() {
    assertThat(validation.maxFileSize()).isEqualTo(1000 * MIB);
    assertThat(validation.maxFileSize()).isGreaterThan(strategy.streamingThreshold());
  }

  @Test
  void mixedBatch_shouldBeAcceptedAndSpreadAcrossStrategies() {
    FileValidator validator = new FileValidator(validation);
    StrategySelector selector = new StrategySelector(strategy);
    SizedUploadFile photo = new SizedUploadFile("photo.jpg", 5 * MIB, "image/jpeg");
    SizedUploadFile scan = new SizedUploadFile("scan.png", 60 * MIB, "image/png");
    SizedUploadFile video = new SizedUploadFile("clip.mp4", 150 * MIB, "video/mp4");

    for (SizedUploadFile file : List.of(photo, scan, video)) {
      ValidationResult result = validator.validateFile(file);
      assertThat(result.valid()).as(file.name()).isTrue();
    }
    assertThat(selector.selectStrategy(photo)).isEqualTo(UploadStrategy.DIRECT);
    assertThat(selector.selectStrategy(scan)).isEqualTo(UploadStrategy.CHUNKED);
    assertThat(selector.selectStrategy(video)).isEqualTo(UploadStrategy.STREAMING);
  }
}
