package com.querybridge.config;

import com.querybridge.error.ErrorKind;
import com.querybridge.error.ExceptionTaxonomyMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

@Slf4j
@Configuration
public class QueryBridgeConfig {

    /**
     * One thread per running statement; each blocks for as long as its remote query runs.
     *
     * @return worker pool
     */
    @Bean(name = "queryExecutionWorkers", destroyMethod = "shutdownNow")
    public ExecutorService queryExecutionWorkers() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "query-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(threadFactory);
    }

    @Bean
    public ExceptionTaxonomyMapper exceptionTaxonomyMapper(
            @Value("${querybridge.exceptions.connection-overrides:}") String[] connectionOverrides,
            @Value("${querybridge.exceptions.database-families:}") String[] databaseFamilies,
            @Value("${querybridge.exceptions.operational-families:}") String[] operationalFamilies,
            @Value("${querybridge.exceptions.programming-families:}") String[] programmingFamilies
    ) {
        ExceptionTaxonomyMapper.Builder builder = ExceptionTaxonomyMapper.jdbcDefaults();
        register(connectionOverrides, type -> builder.override(type, ErrorKind.CONNECTION_ERROR));
        register(databaseFamilies, builder::internalFamily);
        register(operationalFamilies, builder::operationalFamily);
        register(programmingFamilies, builder::programmingFamily);
        ExceptionTaxonomyMapper mapper = builder.build();
        log.info("Loaded {} exception mapping rules", mapper.getRules().size());
        return mapper;
    }

    private static void register(String[] classNames, Consumer<Class<? extends Throwable>> registrar) {
        if (classNames == null) {
            return;
        }
        for (String className : classNames) {
            if (className == null || className.isBlank()) {
                continue;
            }
            Class<? extends Throwable> type = loadThrowable(className.trim());
            if (type != null) {
                registrar.accept(type);
            }
        }
    }

    static Class<? extends Throwable> loadThrowable(String className) {
        try {
            Class<?> type = Class.forName(className, false, QueryBridgeConfig.class.getClassLoader());
            if (!Throwable.class.isAssignableFrom(type)) {
                log.warn("Skipping exception mapping for {}: not a Throwable", className);
                return null;
            }
            return type.asSubclass(Throwable.class);
        } catch (ClassNotFoundException e) {
            // Driver not on the classpath.
            log.warn("Skipping exception mapping for {}: class not found", className);
            return null;
        }
    }
}
