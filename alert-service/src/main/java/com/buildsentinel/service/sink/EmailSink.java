package com.buildsentinel.service.sink;

import com.buildsentinel.core.delivery.AlertSink;
import com.buildsentinel.core.delivery.DeliveryException;
import com.buildsentinel.core.model.AlertMessage;
import com.buildsentinel.core.model.Channel;
import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Date;
import java.util.Objects;
import java.util.Properties;

/**
 * Sends the rendered alert as a plain-text email over SMTP with STARTTLS.
 *
 * <p>
 * The recipient is the rule's target when given, otherwise the configured
 * alert address. The SMTP user doubles as the sender address.
 * </p>
 *
 * @since 1.0.0
 */
public class EmailSink implements AlertSink {

    private static final Logger LOG = LoggerFactory.getLogger(EmailSink.class);

    private final String smtpHost;
    private final int smtpPort;
    private final String smtpUser;
    private final String smtpPassword;
    private final String defaultRecipient;
    private final Duration timeout;

    public EmailSink(String smtpHost, int smtpPort, String smtpUser, String smtpPassword,
                     String defaultRecipient, Duration timeout) {
        this.smtpHost = blankToNull(smtpHost);
        this.smtpPort = smtpPort;
        this.smtpUser = blankToNull(smtpUser);
        this.smtpPassword = smtpPassword;
        this.defaultRecipient = blankToNull(defaultRecipient);
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public Channel channel() {
        return Channel.EMAIL;
    }

    @Override
    public void send(String target, AlertMessage message) throws DeliveryException {
        String recipient = target != null && !target.isBlank() ? target.trim() : defaultRecipient;
        if (smtpHost == null || smtpUser == null || recipient == null) {
            throw new DeliveryException(Channel.EMAIL,
                    "Email delivery is not configured (SMTP host, user and recipient are required)");
        }
        try {
            Transport.send(buildMessage(recipient, message));
            LOG.debug("Email alert '{}' sent to {}", message.getSubject(), recipient);
        } catch (MessagingException e) {
            throw new DeliveryException(Channel.EMAIL, "SMTP delivery to " + recipient + " failed: "
                    + e.getMessage(), e);
        }
    }

    MimeMessage buildMessage(String recipient, AlertMessage message) throws MessagingException {
        MimeMessage mime = new MimeMessage(session());
        mime.setFrom(new InternetAddress(smtpUser));
        mime.setRecipients(Message.RecipientType.TO, InternetAddress.parse(recipient));
        mime.setSubject(message.getSubject(), StandardCharsets.UTF_8.name());
        mime.setSentDate(new Date());
        mime.setText(message.getText(), StandardCharsets.UTF_8.name());
        return mime;
    }

    private Session session() {
        Properties props = new Properties();
        props.put("mail.smtp.host", smtpHost);
        props.put("mail.smtp.port", String.valueOf(smtpPort));
        props.put("mail.smtp.auth", "true");
        props.put("mail.smtp.starttls.enable", "true");
        props.put("mail.smtp.connectiontimeout", String.valueOf(timeout.toMillis()));
        props.put("mail.smtp.timeout", String.valueOf(timeout.toMillis()));
        props.put("mail.smtp.writetimeout", String.valueOf(timeout.toMillis()));
        return Session.getInstance(props, new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(smtpUser, smtpPassword == null ? "" : smtpPassword);
            }
        });
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
