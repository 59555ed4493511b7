package com.di.streamshift.config;

import com.amazonaws.auth.AWSCredentialsProvider;
import com.di.streamshift.jdbc.JdbcWarehouseDriver;
import com.di.streamshift.jdbc.WarehouseDriver;
import com.di.streamshift.jdbc.WarehouseGateway;
import com.di.streamshift.load.LoadExecutor;
import com.di.streamshift.load.StagingWriter;
import com.di.streamshift.relation.WarehouseSourceProvider;
import com.di.streamshift.storage.StagingPathAllocator;
import com.di.streamshift.storage.StagingStorageFactory;
import com.di.streamshift.unload.UnloadExecutor;
import com.di.streamshift.util.MetricsCollector;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the warehouse driver, gateway, executors and the {@link WarehouseSourceProvider}.
 * Hosts replace the driver (or any other bean) by declaring their own.
 */
@Configuration
public class WarehouseClientConfig {

    @Bean
    @ConditionalOnMissingBean(WarehouseDriver.class)
    public WarehouseDriver warehouseDriver() {
        return new JdbcWarehouseDriver();
    }

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public MetricsCollector metricsCollector(MeterRegistry meterRegistry) {
        return new MetricsCollector(meterRegistry);
    }

    @Bean
    public WarehouseGateway warehouseGateway(WarehouseDriver driver, StreamShiftProperties properties) {
        return new WarehouseGateway(driver, properties.getWarehouse().getDefaultQueryTimeoutSec());
    }

    @Bean
    public LoadExecutor loadExecutor(WarehouseGateway gateway, StagingStorageFactory storageFactory,
                                     AWSCredentialsProvider credentialsProvider, StagingPathAllocator allocator,
                                     StreamShiftProperties properties, MetricsCollector metrics) {
        return new LoadExecutor(gateway, storageFactory, credentialsProvider, allocator,
                new StagingWriter(properties.getStaging().getWriteConcurrency()), metrics);
    }

    @Bean
    public UnloadExecutor unloadExecutor(WarehouseGateway gateway, StagingStorageFactory storageFactory,
                                         AWSCredentialsProvider credentialsProvider, StagingPathAllocator allocator,
                                         MetricsCollector metrics) {
        return new UnloadExecutor(gateway, storageFactory, credentialsProvider, allocator, metrics);
    }

    @Bean
    public WarehouseSourceProvider warehouseSourceProvider(WarehouseGateway gateway, UnloadExecutor unloadExecutor,
                                                           LoadExecutor loadExecutor) {
        return new WarehouseSourceProvider(gateway, unloadExecutor, loadExecutor);
    }
}
