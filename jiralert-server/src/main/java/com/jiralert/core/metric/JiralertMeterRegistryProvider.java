package com.jiralert.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;

import java.util.List;

/**
 * 把 Prometheus 注册表与业务接入的注册表合并成一个复合注册表
 */
public class JiralertMeterRegistryProvider {

    private final CompositeMeterRegistry composite;

    public JiralertMeterRegistryProvider(MeterRegistry primary, List<MeterRegistry> discovered) {
        this.composite = new CompositeMeterRegistry();
        this.composite.add(primary);

        // 把外部业务接入的注册表也合入
        if (discovered != null && !discovered.isEmpty()) {
            for (MeterRegistry mr : discovered) {
                if (mr == primary) {
                    continue;
                }
                if (!(mr instanceof CompositeMeterRegistry)) {
                    this.composite.add(mr);
                } else {
                    ((CompositeMeterRegistry) mr).getRegistries().forEach(this.composite::add);
                }
            }
        }
    }

    public MeterRegistry getRegistry() { return composite; }
}
