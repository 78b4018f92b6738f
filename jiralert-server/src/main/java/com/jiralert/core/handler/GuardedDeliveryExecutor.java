package com.jiralert.core.handler;

import com.jiralert.config.JiralertGuardProperties;
import com.jiralert.exception.TrackerRejectedException;
import com.jiralert.exception.guard.DownstreamBulkheadFullException;
import com.jiralert.exception.guard.DownstreamOpenCircuitException;
import com.jiralert.exception.guard.DownstreamRateLimitedException;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * 按接收者对投递做 RL/BH/CB 保护
 */
public class GuardedDeliveryExecutor {

    private final JiralertGuardProperties props;

    private final ConcurrentHashMap<String, CircuitBreaker> cbCache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Bulkhead>      bhCache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RateLimiter>   rlCache = new ConcurrentHashMap<>();

    public GuardedDeliveryExecutor(JiralertGuardProperties props) {
        this.props = props;
    }

    /**
     * 统一入口
     * 对 delivery 增加 CB/BH/RL 装饰后执行
     */
    public void execute(String receiver, Runnable delivery) {
        if (!props.isEnabled()) {
            delivery.run();
            return;
        }
        // 组合装饰 RateLimiter → Bulkhead → CircuitBreaker
        Runnable decorated = delivery;

        // CircuitBreaker 最内层, 只记录真正发出的调用
        if (enabled(props.getCircuitBreaker(), props.getCbPerReceiver(), receiver, JiralertGuardProperties.CbConfig::isEnabled)) {
            CircuitBreaker cb = cbCache.computeIfAbsent(receiver, this::buildCb);
            decorated = CircuitBreaker.decorateRunnable(cb, decorated);
        }

        // Bulkhead 限制下游并发
        if (enabled(props.getBulkhead(), props.getBhPerReceiver(), receiver, JiralertGuardProperties.BhConfig::isEnabled)) {
            Bulkhead bh = bhCache.computeIfAbsent(receiver, this::buildBh);
            decorated = Bulkhead.decorateRunnable(bh, decorated);
        }

        // RateLimit最外层限流，抑制告警风暴
        if (enabled(props.getRateLimiter(), props.getRlPerReceiver(), receiver, JiralertGuardProperties.RlConfig::isEnabled)) {
            RateLimiter rl = rlCache.computeIfAbsent(receiver, this::buildRl);
            decorated = RateLimiter.decorateRunnable(rl, decorated);
        }

        try {
            decorated.run();
        } catch (CallNotPermittedException open) {
            // 熔断打开 → 可重试, 交给上游稍后重发
            throw new DownstreamOpenCircuitException(receiver, open);
        } catch (BulkheadFullException full) {
            throw new DownstreamBulkheadFullException(receiver, full);
        } catch (RequestNotPermitted rnp) {
            throw new DownstreamRateLimitedException(receiver, rnp);
        }
    }

    private RateLimiter buildRl(String receiver) {
        JiralertGuardProperties.RlConfig r = pick(props.getRateLimiter(), props.getRlPerReceiver(), receiver);
        RateLimiterConfig cfg = RateLimiterConfig.custom()
                .limitForPeriod(r.getLimitForPeriod())
                .limitRefreshPeriod(r.getLimitRefreshPeriod())
                .timeoutDuration(r.getTimeoutDuration())
                .build();
        return RateLimiter.of("rl:" + receiver, cfg);
    }

    private Bulkhead buildBh(String receiver) {
        JiralertGuardProperties.BhConfig b = pick(props.getBulkhead(), props.getBhPerReceiver(), receiver);
        BulkheadConfig cfg = BulkheadConfig.custom()
                .maxConcurrentCalls(b.getMaxConcurrentCalls())
                .maxWaitDuration(b.getMaxWaitDuration())
                .fairCallHandlingStrategyEnabled(true)
                .build();
        return Bulkhead.of("bh:" + receiver, cfg);
    }

    private CircuitBreaker buildCb(String receiver) {
        JiralertGuardProperties.CbConfig c = pick(props.getCircuitBreaker(), props.getCbPerReceiver(), receiver);
        CircuitBreakerConfig cfg = CircuitBreakerConfig.custom()
                .failureRateThreshold(c.getFailureRateThreshold())
                .slowCallRateThreshold(c.getSlowCallRateThreshold())
                .slowCallDurationThreshold(c.getSlowCallDurationThreshold())
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(c.getSlidingWindowSize())
                .minimumNumberOfCalls(c.getMinimumNumberOfCalls())
                .waitDurationInOpenState(c.getWaitDurationInOpenState())
                .permittedNumberOfCallsInHalfOpenState(c.getPermittedNumberOfCallsInHalfOpenState())
                .recordExceptions(Throwable.class)
                // Jira 明确拒绝（4xx）不代表下游故障, 不计入失败率
                .ignoreExceptions(TrackerRejectedException.class)
                .build();
        return CircuitBreaker.of("cb:" + receiver, cfg);
    }

    private static <C> C pick(C defaultCfg, Map<String, C> map, String receiver) {
        if (map == null) {
            return defaultCfg;
        }
        return map.getOrDefault(receiver, defaultCfg);
    }

    private static <C> boolean enabled(C defaultCfg, Map<String, C> map, String receiver, Predicate<C> isEnabled) {
        C cfg = pick(defaultCfg, map, receiver);
        return cfg != null && isEnabled.test(cfg);
    }
}
