package com.ringai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 公共线程池配置，前缀 thread.pool.executor.config。
 * <p>
 * 该线程池承载路由评估、交互记录写入和会话批量关闭等阻塞调用。
 * </p>
 *
 * @author ringai
 * @since 2026-03-05
 */
@Data
@ConfigurationProperties(prefix = "thread.pool.executor.config", ignoreInvalidFields = true)
public class ThreadPoolConfigProperties {

    /** 核心线程数 */
    private Integer corePoolSize = 16;

    /** 最大线程数 */
    private Integer maxPoolSize = 64;

    /** 空闲线程存活时间（秒） */
    private Long keepAliveTime = 30L;

    /** 阻塞队列容量 */
    private Integer blockQueueSize = 2000;

    /** 线程名前缀 */
    private String threadNamePrefix = "ring-common-";

    /**
     * 拒绝策略：AbortPolicy、DiscardPolicy、DiscardOldestPolicy、CallerRunsPolicy。
     */
    private String policy = "CallerRunsPolicy";

}
