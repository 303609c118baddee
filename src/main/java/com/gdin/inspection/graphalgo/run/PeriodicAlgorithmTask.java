package com.gdin.inspection.graphalgo.run;

import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.graphalgo.config.properties.GraphAlgoProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 按 cron 定时跑批量任务，gdin.ai.graph-algo.scheduler.enabled=true 时才注册。
 *
 * 同一时刻只允许一个任务在跑，上一次没结束时本次触发直接跳过。
 * 生命周期跟随 Spring 容器，容器关闭即停止调度。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "gdin.ai.graph-algo.scheduler", name = "enabled", havingValue = "true")
public class PeriodicAlgorithmTask implements SmartLifecycle {

    private final GraphAlgoRunner runner;

    private final GraphAlgoProperties.Scheduler config;

    private final AtomicBoolean executing = new AtomicBoolean(false);

    private volatile ThreadPoolTaskScheduler scheduler;

    private volatile ScheduledFuture<?> future;

    private volatile Instant lastRunTime;

    private volatile JobReport lastReport;

    public PeriodicAlgorithmTask(GraphAlgoRunner runner, GraphAlgoProperties graphAlgoProperties) {
        this.runner = runner;
        this.config = graphAlgoProperties.getScheduler();
    }

    @Override
    public synchronized void start() {
        if (isRunning()) return;

        String cron = normalizeCron(config.getCron());
        ZoneId zone = ZoneId.of(config.getTimezone());
        AlgorithmScope scope = AlgorithmScope.from(config.getAlgorithmType());

        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(1);
        s.setThreadNamePrefix("graph-algo-");
        s.setWaitForTasksToCompleteOnShutdown(false);
        s.initialize();

        this.scheduler = s;
        this.future = s.schedule(() -> trigger(scope), new CronTrigger(cron, zone));
        log.info("定时任务已启动：cron={}, timezone={}, scope={}", cron, zone, scope);
    }

    @Override
    public synchronized void stop() {
        if (future != null) {
            future.cancel(false);
            future = null;
        }
        if (scheduler != null) {
            scheduler.shutdown();
            scheduler = null;
            log.info("定时任务已停止");
        }
    }

    @Override
    public boolean isRunning() {
        return scheduler != null;
    }

    /**
     * 立即跑一次，异常向上抛出。
     *
     * @return 本次报告；已有任务在跑时返回 null
     */
    public JobReport runOnce(AlgorithmScope scope) {
        if (!executing.compareAndSet(false, true)) {
            log.warn("上一次任务尚未结束，跳过本次 {} 任务", scope);
            return null;
        }
        try {
            JobReport report = runner.runJob(scope, config.isCreateCommunityNodes());
            lastRunTime = Instant.now();
            lastReport = report;
            return report;
        } finally {
            executing.set(false);
        }
    }

    public Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("running", isRunning());
        status.put("executing", executing.get());
        status.put("cron", config.getCron());
        status.put("timezone", config.getTimezone());
        status.put("algorithm_type", AlgorithmScope.from(config.getAlgorithmType()).name().toLowerCase());
        status.put("last_run_time", lastRunTime);
        status.put("last_total_results", lastReport == null ? null : lastReport.getTotalResults());
        return status;
    }

    // 定时触发的异常只记录，不影响下一次调度
    private void trigger(AlgorithmScope scope) {
        try {
            runOnce(scope);
        } catch (Exception e) {
            log.error("定时 {} 任务失败", scope, e);
        }
    }

    /**
     * 兼容五段式 crontab（分 时 日 月 周），自动补上秒字段。
     */
    static String normalizeCron(String cron) {
        String trimmed = StrUtil.trim(cron);
        if (StrUtil.isBlank(trimmed)) {
            throw new IllegalArgumentException("scheduler cron must not be blank");
        }
        return trimmed.split("\\s+").length == 5 ? "0 " + trimmed : trimmed;
    }
}
