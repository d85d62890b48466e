package com.retrygate.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;

public class RetryGateMeterRegistryProvider {

    private final CompositeMeterRegistry composite;

    public RetryGateMeterRegistryProvider(List<MeterRegistry> discovered) {
        // 保底 Simple
        this.composite = new CompositeMeterRegistry();
        this.composite.add(new SimpleMeterRegistry());

        // 合入宿主的注册表
        if (discovered != null && !discovered.isEmpty()) {
            for (MeterRegistry mr : discovered) {
                if (mr instanceof CompositeMeterRegistry cmr) {
                    cmr.getRegistries().forEach(this.composite::add);
                } else {
                    this.composite.add(mr);
                }
            }
        }
    }

    public MeterRegistry getRegistry() { return composite; }
}
