/* (C)2026 */
package com.ammann.carbon.health;

import java.lang.management.ManagementFactory;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;

/**
 * Liveness health check that reports the service as alive while the JVM responds.
 *
 * <p>Pattern availability is not part of liveness: a region without history must never get the
 * process restarted. See {@link PatternStoreHealthCheck} for readiness.
 */
@Liveness
public class LivenessCheck implements HealthCheck
{

    @Override
    public HealthCheckResponse call()
    {
        return HealthCheckResponse.named("alive")
                .up()
                .withData("uptime-seconds", ManagementFactory.getRuntimeMXBean().getUptime() / 1000)
                .build();
    }

}
