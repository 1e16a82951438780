package com.coagent.workflow.core.engine.rest;

import com.coagent.workflow.core.engine.CoAgentFacade;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.http.server.reactive.HttpHandler;
import org.springframework.http.server.reactive.ReactorHttpHandlerAdapter;
import org.springframework.web.server.adapter.WebHttpHandlerBuilder;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;

/**
 * Standalone HTTP server exposing {@link WorkflowController} on Reactor Netty.
 */
@Slf4j
public final class CoAgentWorkflowServer {

    private CoAgentWorkflowServer() {
    }

    public static void main(String[] args) {
        int port = CoAgentFacade.getInstance().getSettings().getServerPort();
        AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext(WorkflowApiConfiguration.class);
        HttpHandler handler = WebHttpHandlerBuilder.applicationContext(context).build();

        DisposableServer server = HttpServer.create()
                .port(port)
                .handle(new ReactorHttpHandlerAdapter(handler))
                .bindNow();
        log.info("CoAgent workflow server listening on port {}", server.port());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down CoAgent workflow server");
            server.disposeNow();
            context.close();
            CoAgentFacade.getInstance().shutdown();
        }, "coagent-shutdown"));

        server.onDispose().block();
    }
}
