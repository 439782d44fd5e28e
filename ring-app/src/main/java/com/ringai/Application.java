package com.ringai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 通话桥接服务启动类。
 * <p>
 * 位于顶层包，扫描各模块的组件与 MyBatis Mapper。
 * </p>
 *
 * @author ringai
 * @since 2026-03-02
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
