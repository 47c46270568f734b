package com.asiainfo.semantic;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import org.eclipse.microprofile.config.ConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 应用程序主类
 * Quarkus启动入口
 */
@QuarkusMain
public class Application {

    private static final Logger log = LoggerFactory.getLogger(Application.class);

    public static void main(String[] args) {
        Quarkus.run(App.class, args);
    }

    /**
     * 应用程序实例
     */
    public static class App implements QuarkusApplication {

        @Override
        public int run(String... args) throws Exception {
            log.info("[Startup] semantic-model-runtime 已启动, model={}",
                    ConfigProvider.getConfig()
                            .getOptionalValue("semantic.model.location", String.class)
                            .orElse("-"));
            Quarkus.waitForExit();
            return 0;
        }
    }
}
