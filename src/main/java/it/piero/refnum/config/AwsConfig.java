package it.piero.refnum.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.rekognition.RekognitionClient;
import software.amazon.awssdk.services.rekognition.RekognitionClientBuilder;
import software.amazon.awssdk.services.textract.TextractClient;

import java.net.URI;

/**
 * Client del solo motore OCR scelto con {@code refnum.ocr.provider}.
 */
@Slf4j
@Configuration
public class AwsConfig {

    @Value("${aws.defaultTextractRegion}")
    private String textractRegion;

    @Value("${aws.defaultRekognitionRegion}")
    private String rekognitionRegion;

    @Value("${aws.defaultRekognitionEndpoint:}")
    private String rekognitionEndpoint;

    @Bean
    @ConditionalOnProperty(prefix = "refnum.ocr", name = "provider", havingValue = "textract", matchIfMissing = true)
    public TextractClient textractClient() {
        log.info("OCR delle tavole con Textract ({})", textractRegion);
        return TextractClient.builder()
                .region(Region.of(textractRegion))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "refnum.ocr", name = "provider", havingValue = "rekognition")
    public RekognitionClient rekognitionClient() {
        log.info("OCR delle tavole con Rekognition ({})", rekognitionRegion);
        RekognitionClientBuilder builder = RekognitionClient.builder()
                .region(Region.of(rekognitionRegion))
                .credentialsProvider(DefaultCredentialsProvider.create());
        if (!rekognitionEndpoint.isBlank()) {
            builder.endpointOverride(URI.create(rekognitionEndpoint));
        }
        return builder.build();
    }
}
