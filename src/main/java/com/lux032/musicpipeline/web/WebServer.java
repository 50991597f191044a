package com.lux032.musicpipeline.web;

import com.lux032.musicpipeline.core.OrchestratorContext;
import com.lux032.musicpipeline.worker.WorkerPool;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jetty.server.ForwardedRequestCustomizer;
import org.eclipse.jetty.server.HttpConfiguration;
import org.eclipse.jetty.server.HttpConnectionFactory;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;

/**
 * 嵌入式 Web 服务器
 * 提供状态、统计和手动触发接口
 */
@Slf4j
public class WebServer {

    private Server server;
    private final int port;

    public WebServer(int port) {
        this.port = port;
    }

    /**
     * 启动 Web 服务器
     */
    public void start(OrchestratorContext context, WorkerPool workerPool) throws Exception {
        server = new Server();

        HttpConfiguration httpConfig = new HttpConfiguration();
        httpConfig.setSendServerVersion(false);
        httpConfig.setSendDateHeader(false);

        // 支持反向代理头信息 X-Forwarded-*
        httpConfig.addCustomizer(new ForwardedRequestCustomizer());

        ServerConnector connector = new ServerConnector(server, new HttpConnectionFactory(httpConfig));
        connector.setPort(port);
        connector.setHost("0.0.0.0");  // 监听所有网络接口
        server.addConnector(connector);

        ServletContextHandler servletHandler = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        servletHandler.setContextPath("/");

        servletHandler.addServlet(new ServletHolder(new WatcherStatusServlet(context, workerPool)), "/api/watcher/*");
        servletHandler.addServlet(new ServletHolder(new InboxServlet(context)), "/api/inbox/*");
        servletHandler.addServlet(new ServletHolder(new LibraryServlet(context)), "/api/library/*");
        servletHandler.addServlet(new ServletHolder(new CoverServlet(context)), "/api/cover/*");
        servletHandler.addServlet(new ServletHolder(new LyricsServlet(context)), "/api/lyrics/*");
        servletHandler.addServlet(new ServletHolder(new SlskdServlet(context.getSlskdClient())), "/api/slskd/*");

        server.setHandler(servletHandler);
        server.start();

        log.info("========================================");
        log.info("Web API started");
        log.info("URL: http://localhost:{}", port);
        log.info("========================================");
    }

    /**
     * 停止 Web 服务器
     */
    public void stop() throws Exception {
        if (server != null && server.isRunning()) {
            server.stop();
            log.info("Web server stopped");
        }
    }

    /**
     * 检查服务器是否正在运行
     */
    public boolean isRunning() {
        return server != null && server.isRunning();
    }
}
