package com.tablescan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the pipeline stages from {@link TableScanProperties}. Images and cell recognition
 * use separate pools: an image task waits on its recognition tasks, so sharing one bounded
 * pool could deadlock.
 */
@Configuration
@EnableConfigurationProperties(TableScanProperties.class)
public class TableScanConfig {

    private static final Logger log = LoggerFactory.getLogger(TableScanConfig.class);

    @Bean(destroyMethod = "shutdown")
    public ExecutorService recognitionExecutor(TableScanProperties properties) {
        return Executors.newFixedThreadPool(properties.getRecognition().getThreads(), namedThreads("recognize-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService imageExecutor(TableScanProperties properties) {
        return Executors.newFixedThreadPool(properties.getRecognition().getImageThreads(), namedThreads("table-"));
    }

    @Bean
    @ConditionalOnMissingBean(TextRecognizer.class)
    public TextRecognizer textRecognizer() {
        return new VisionTextRecognizer();
    }

    @Bean
    public DebugImageSink debugImageSink(TableScanProperties properties) {
        String directory = properties.getDebug().getDirectory();
        if (directory == null || directory.isBlank()) {
            return DebugImageSink.NONE;
        }
        log.info("Writing intermediate images to {}", directory);
        return new DirectoryDebugImageSink(Path.of(directory));
    }

    @Bean
    public TablePipeline tablePipeline(TableScanProperties properties, TextRecognizer textRecognizer,
                                       DebugImageSink debugImageSink,
                                       @Qualifier("recognitionExecutor") ExecutorService recognitionExecutor,
                                       @Qualifier("imageExecutor") ExecutorService imageExecutor) {
        return new TablePipeline(
                new TableLocator(properties.getLocator(), debugImageSink),
                new StructureRemover(properties.getStructure(), debugImageSink),
                new CellExtractor(properties.getCells(), textRecognizer, recognitionExecutor, debugImageSink),
                imageExecutor);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
