/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.stepflow.controller.observability;

import dev.mars.stepflow.controller.config.AppConfig;
import io.opentelemetry.exporter.prometheus.PrometheusHttpServer;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.resources.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Installs the OpenTelemetry SDK with a Prometheus scrape endpoint.
 *
 * <p>Must run before the first workflow metric is recorded, since the metrics
 * singleton binds to {@code GlobalOpenTelemetry} on first use. When telemetry is
 * disabled nothing is registered and the metrics calls become no-ops.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-18
 */
public final class TelemetryConfig {

    private static final Logger logger = LoggerFactory.getLogger(TelemetryConfig.class);

    private static OpenTelemetrySdk openTelemetry;
    private static int configuredPrometheusPort;

    private TelemetryConfig() {
    }

    /**
     * @return true when the SDK was installed
     */
    public static synchronized boolean configure(AppConfig config) {
        if (!config.isTelemetryEnabled()) {
            logger.info("Telemetry is disabled");
            return false;
        }
        if (openTelemetry != null) {
            logger.debug("Telemetry already configured");
            return true;
        }

        configuredPrometheusPort = config.getPrometheusPort();
        String serviceName = config.getServiceName();

        Resource resource = Resource.getDefault().toBuilder()
                .put("service.name", serviceName)
                .put("service.version", config.getVersion())
                .build();

        PrometheusHttpServer prometheusReader = PrometheusHttpServer.builder()
                .setPort(configuredPrometheusPort)
                .build();

        SdkMeterProvider meterProvider = SdkMeterProvider.builder()
                .setResource(resource)
                .registerMetricReader(prometheusReader)
                .build();

        openTelemetry = OpenTelemetrySdk.builder()
                .setMeterProvider(meterProvider)
                .buildAndRegisterGlobal();

        logger.info("OpenTelemetry configured: service={}, prometheus port={}", serviceName, configuredPrometheusPort);
        return true;
    }

    public static int getPrometheusPort() {
        return configuredPrometheusPort;
    }

    /**
     * Flushes and closes the SDK. Safe to call when telemetry was never configured.
     */
    public static synchronized void shutdown() {
        if (openTelemetry != null) {
            openTelemetry.close();
            openTelemetry = null;
            logger.info("OpenTelemetry shut down");
        }
    }
}
