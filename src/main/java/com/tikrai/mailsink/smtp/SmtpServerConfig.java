package com.tikrai.mailsink.smtp;

import com.tikrai.mailsink.auth.RelayAuthorizer;
import com.tikrai.mailsink.ingest.IngestPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.subethamail.smtp.MessageHandlerFactory;
import org.subethamail.smtp.server.SMTPServer;

/**
 * Starts the SMTP listener and, as the "mail acceptor" of the shutdown sequence, stops it.
 */
@Configuration
public class SmtpServerConfig implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(SmtpServerConfig.class);

  private SMTPServer server;

  @Bean(destroyMethod = "")
  public SMTPServer smtpServer(IngestPipeline pipeline, RelayAuthorizer authorizer, Environment env) {

    String host = env.getProperty("app.smtp.host", "0.0.0.0");
    int port = Integer.parseInt(env.getProperty("app.smtp.port", "8025"));

    log.info("Starting SMTP server - host: {}, port: {}", host, port);

    MessageHandlerFactory factory = ctx -> {
      log.info("SMTP NEW CONNECTION - RemoteAddress: {}", ctx != null ? ctx.getRemoteAddress() : "unknown");
      return new DomainFilterMessageHandler(authorizer, pipeline);
    };
    SMTPServer s = new SMTPServer(factory);
    s.setHostName(host);
    s.setPort(port);

    // no STARTTLS: TLS is terminated by the mail proxy in front
    s.setHideTLS(true);
    s.setSoftwareName("TikraiMailSink");

    s.start();
    log.info("SMTP server started successfully - host: {}, port: {}, listening on all interfaces", host, port);
    this.server = s;
    return s;
  }

  @Override
  public synchronized void close() {
    if (server != null) {
      log.info("Stopping SMTP server");
      server.stop();
      server = null;
      log.info("SMTP server stopped");
    }
  }
}
