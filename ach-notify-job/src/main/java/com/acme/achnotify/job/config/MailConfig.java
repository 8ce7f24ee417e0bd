package com.acme.achnotify.job.config;

import java.util.Properties;

/** SMTP settings of the outbound mail session. */
public class MailConfig {

  private String host = "localhost";
  private int port = 25;
  private String username;
  private String password;
  private boolean startTls;
  private String defaultFrom;
  private int timeoutMillis = 30_000;

  public String getHost() {
    return host;
  }

  public void setHost(String host) {
    this.host = host;
  }

  public int getPort() {
    return port;
  }

  public void setPort(int port) {
    this.port = port;
  }

  public String getUsername() {
    return username;
  }

  public void setUsername(String username) {
    this.username = username;
  }

  public String getPassword() {
    return password;
  }

  public void setPassword(String password) {
    this.password = password;
  }

  public boolean isStartTls() {
    return startTls;
  }

  public void setStartTls(boolean startTls) {
    this.startTls = startTls;
  }

  /** Sender used when the configured author is an employee id rather than an address. */
  public String getDefaultFrom() {
    return defaultFrom;
  }

  public void setDefaultFrom(String defaultFrom) {
    this.defaultFrom = defaultFrom;
  }

  public int getTimeoutMillis() {
    return timeoutMillis;
  }

  public void setTimeoutMillis(int timeoutMillis) {
    this.timeoutMillis = timeoutMillis;
  }

  public boolean hasCredentials() {
    return username != null && !username.isBlank();
  }

  /** Session properties in the mail.smtp.* namespace. */
  public Properties toSessionProperties() {
    Properties props = new Properties();
    props.put("mail.smtp.host", host);
    props.put("mail.smtp.port", String.valueOf(port));
    props.put("mail.smtp.auth", String.valueOf(hasCredentials()));
    props.put("mail.smtp.starttls.enable", String.valueOf(startTls));
    props.put("mail.smtp.connectiontimeout", String.valueOf(timeoutMillis));
    props.put("mail.smtp.timeout", String.valueOf(timeoutMillis));
    props.put("mail.smtp.writetimeout", String.valueOf(timeoutMillis));
    return props;
  }
}
