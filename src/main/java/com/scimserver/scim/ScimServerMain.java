package com.scimserver.scim;

import com.scimserver.scim.config.ScimObjectMapperProvider;
import com.scimserver.scim.config.ScimServerConfig;
import com.scimserver.scim.endpoints.EndpointGroupScimEndpoint;
import com.scimserver.scim.endpoints.EndpointUserScimEndpoint;
import com.scimserver.scim.endpoints.ServiceProviderConfigEndpoint;
import com.scimserver.scim.exceptions.ScimExceptionMapper;
import com.scimserver.scim.repository.InMemoryScimResourceRepository;
import com.scimserver.scim.repository.ScimResourceRepository;
import com.scimserver.scim.service.EndpointScimService;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.server.handler.ContextHandlerCollection;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.glassfish.hk2.utilities.binding.AbstractBinder;
import org.glassfish.jersey.jackson.JacksonFeature;
import org.glassfish.jersey.server.ResourceConfig;
import org.glassfish.jersey.servlet.ServletContainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Main class for the SCIM server with embedded Jetty.
 *
 * <p>SCIM routes are served under {@code /scim/v2}; {@code /health} sits on the root context.</p>
 */
public class ScimServerMain {

    private static final Logger logger = LoggerFactory.getLogger(ScimServerMain.class);

    static final String SCIM_CONTEXT_PATH = "/scim/v2";

    public static void main(String[] args) {
        try {
            ScimServerConfig config = ScimServerConfig.getInstance();
            logger.info("Starting SCIM Server...");
            logger.info("Configuration: {}", config);

            Server server = createServer(config);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down SCIM Server...");
                try {
                    server.stop();
                    logger.info("SCIM Server stopped");
                } catch (Exception e) {
                    logger.error("Error stopping server", e);
                }
            }));

            server.start();
            logger.info("SCIM Server started successfully");
            logger.info("SCIM Endpoints: {}/endpoints/{endpointId}/Users", config.getScimServerBaseUrl());
            logger.info("Health check: http://localhost:{}/health", config.getPort());

            server.join();

        } catch (Exception e) {
            logger.error("Failed to start SCIM Server", e);
            System.exit(1);
        }
    }

    /**
     * Build the Jetty server with the SCIM and health contexts; the server is not started.
     */
    static Server createServer(ScimServerConfig config) {
        ScimResourceRepository repository = new InMemoryScimResourceRepository();
        EndpointScimService scimService = new EndpointScimService(repository, config);

        Server server = new Server();
        ServerConnector connector = new ServerConnector(server);
        connector.setPort(config.getPort());
        server.addConnector(connector);

        ServletContextHandler scimContext = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        scimContext.setContextPath(SCIM_CONTEXT_PATH);

        ServletHolder jerseyServlet = new ServletHolder(new ServletContainer(createResourceConfig(repository, scimService)));
        jerseyServlet.setInitOrder(0);
        scimContext.addServlet(jerseyServlet, "/*");

        ServletContextHandler healthContext = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        healthContext.setContextPath("/");
        healthContext.addServlet(new ServletHolder(new HealthCheckServlet()), "/health");

        ContextHandlerCollection handlers = new ContextHandlerCollection();
        handlers.addHandler(healthContext);
        handlers.addHandler(scimContext);
        server.setHandler(handlers);
        return server;
    }

    /**
     * Jersey application: endpoints, providers and the shared service instances.
     */
    static ResourceConfig createResourceConfig(ScimResourceRepository repository, EndpointScimService scimService) {
        ResourceConfig resourceConfig = new ResourceConfig();

        resourceConfig.register(ServiceProviderConfigEndpoint.class);
        resourceConfig.register(EndpointUserScimEndpoint.class);
        resourceConfig.register(EndpointGroupScimEndpoint.class);

        resourceConfig.register(ScimExceptionMapper.class);
        resourceConfig.register(ScimObjectMapperProvider.class);
        resourceConfig.register(JacksonFeature.class);

        resourceConfig.register(new AbstractBinder() {
            @Override
            protected void configure() {
                bind(repository).to(ScimResourceRepository.class);
                bind(scimService).to(EndpointScimService.class);
            }
        });
        return resourceConfig;
    }

    static class HealthCheckServlet extends HttpServlet {
        @Override
        protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            resp.setContentType("application/json");
            resp.setStatus(200);
            resp.getWriter().write("{\"status\":\"healthy\",\"service\":\"scim-server\"}");
        }
    }
}
