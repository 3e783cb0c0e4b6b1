package com.nisfix.compliance.infrastructure.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingMailer implements Mailer {
  private static final Logger log = LoggerFactory.getLogger(LoggingMailer.class);

  @Override
  public void send(String to, String subject, String body) {
    log.info("Mail to {} - {}\n{}", to, subject, body);
  }
}
