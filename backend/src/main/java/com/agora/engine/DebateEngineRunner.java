package com.agora.engine;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Starts the engine on its own thread once the application is up, and interrupts it on shutdown.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DebateEngineRunner implements ApplicationRunner, DisposableBean {

    private final DebateEngine debateEngine;

    @Value("${app.debate.engine-enabled:true}")
    private boolean engineEnabled;

    private Thread engineThread;

    @Override
    public void run(ApplicationArguments args) {
        if (!engineEnabled) {
            log.info("Debate engine disabled");
            return;
        }
        engineThread = new Thread(debateEngine::run, "debate-engine");
        engineThread.setDaemon(true);
        engineThread.start();
    }

    @Override
    public void destroy() throws InterruptedException {
        if (engineThread != null && engineThread.isAlive()) {
            engineThread.interrupt();
            engineThread.join(2000);
        }
    }
}
