package com.example.rabbitwatch.notification;

import com.example.rabbitwatch.config.RabbitWatchProperties;
import com.example.rabbitwatch.domain.Alert;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailException;
import org.springframework.mail.MailParseException;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Email channel over SMTP. Authentication, parse and preparation failures
 * are terminal; any other mail failure is treated as transient.
 * The SMTP timeouts come from {@code spring.mail.properties}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EmailTransport implements ChannelTransport<EmailMessage> {

    private final JavaMailSender mailSender;
    private final RabbitWatchProperties properties;

    @Override
    public ChannelType type() {
        return ChannelType.EMAIL;
    }

    @Override
    public EmailMessage buildPayload(ChannelTarget target, AlertBatch batch) {
        int count = batch.size();
        String subject = String.format("[RabbitWatch] %d new alert%s on %s",
                count, count == 1 ? "" : "s", batch.serverName());

        StringBuilder body = new StringBuilder()
                .append(count).append(count == 1 ? " new alert" : " new alerts")
                .append(" on ").append(batch.serverName())
                .append(" in workspace ").append(batch.workspaceName()).append("\n\n");
        for (Alert alert : batch.alerts()) {
            body.append('[').append(alert.getSeverity().getValue().toUpperCase(Locale.ROOT)).append("] ")
                    .append(alert.getTitle()).append('\n')
                    .append(alert.getDescription()).append('\n');
            if (alert.getSource() != null) {
                body.append("Source: ").append(alert.getSource().type().getValue())
                        .append(' ').append(alert.getSource().name());
                if (alert.getVhost() != null) {
                    body.append(" (vhost ").append(alert.getVhost()).append(')');
                }
                body.append('\n');
            }
            if (alert.getDetails() != null && alert.getDetails().recommended() != null) {
                body.append("Recommended: ").append(alert.getDetails().recommended()).append('\n');
            }
            body.append('\n');
        }
        String dashboard = properties.getNotifications().getDashboardUrl();
        if (dashboard != null && !dashboard.isBlank()) {
            body.append("View alerts: ").append(dashboard).append("/alerts?serverId=").append(batch.serverId())
                    .append('\n');
        }
        return new EmailMessage(target.endpoint(), subject, body.toString());
    }

    @Override
    public Integer send(ChannelTarget target, EmailMessage payload)
            throws TransientDeliveryException, TerminalDeliveryException {
        if (payload.to() == null || payload.to().isBlank()) {
            throw new TerminalDeliveryException("No contact email configured", (Integer) null);
        }
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(properties.getNotifications().getEmail().getFrom());
        message.setTo(payload.to());
        message.setSubject(payload.subject());
        message.setText(payload.body());
        try {
            mailSender.send(message);
            log.info("Alert email sent to {}", payload.to());
            return null;
        } catch (MailAuthenticationException | MailParseException | MailPreparationException e) {
            throw new TerminalDeliveryException("Mail rejected: " + e.getMessage(), e);
        } catch (MailException e) {
            throw new TransientDeliveryException("Mail delivery failed: " + e.getMessage(), e);
        }
    }
}
