package guraa.docxcompare.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import guraa.docxcompare.core.MoveDetectionSettings;
import guraa.docxcompare.model.CompareOptions;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application configuration.
 */
@Configuration
public class AppConfig {

    /**
     * Configure the ObjectMapper used for JSON responses.
     *
     * @return The configured ObjectMapper
     */
    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();

        // Register the JavaTimeModule to handle Java 8 date/time types
        objectMapper.registerModule(new JavaTimeModule());

        objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        objectMapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        return objectMapper;
    }

    /**
     * Comparison options built from {@code app.comparison}; requests start from a copy of these.
     *
     * @param properties The application properties
     * @return The default options
     */
    @Bean
    public CompareOptions defaultCompareOptions(AppProperties properties) {
        AppProperties.Comparison comparison = properties.getComparison();
        return CompareOptions.builder()
                .author(comparison.getAuthor())
                .reconstructionMode(comparison.getReconstructionMode())
                .engine(comparison.getEngine())
                .moveDetection(MoveDetectionSettings.builder()
                        .detectMoves(comparison.isDetectMoves())
                        .moveSimilarityThreshold(comparison.getMoveSimilarityThreshold())
                        .moveMinimumWordCount(comparison.getMoveMinimumWordCount())
                        .caseInsensitive(comparison.isCaseInsensitiveMove())
                        .tieBreak(comparison.getMoveTieBreak())
                        .build())
                .detectFormatChanges(comparison.isDetectFormatChanges())
                .paragraphSimilarityThreshold(comparison.getParagraphSimilarityThreshold())
                .diffmatchSimilarityThreshold(comparison.getDiffmatchSimilarityThreshold())
                .lcsAlgorithm(comparison.getLcsAlgorithm())
                .verifyRebuild(comparison.isVerifyRebuild())
                .premergeRuns(comparison.isPremergeRuns())
                .build();
    }
}
