package com.adpulse.alerts.channel;

import com.adpulse.alerts.config.AlertEngineConfig;
import com.adpulse.alerts.exception.ChannelException;
import com.adpulse.alerts.model.Alert;
import com.adpulse.alerts.model.AlertPriority;
import com.adpulse.alerts.model.Campaign;
import com.adpulse.alerts.model.Operator;
import com.adpulse.alerts.repository.CampaignRepository;
import com.adpulse.alerts.repository.OperatorRepository;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * HTML alert emails through the configured SMTP relay.
 *
 * Disabled by default ({@code alerts.mail.enabled=false}); while disabled every send fails with
 * ChannelException so the delivery flags stay false.
 */
@Component
public class SmtpEmailSender implements EmailSender {

    private static final Logger log = LoggerFactory.getLogger(SmtpEmailSender.class);

    private static final Map<AlertPriority, String> PRIORITY_COLORS = new EnumMap<>(AlertPriority.class);

    static {
        PRIORITY_COLORS.put(AlertPriority.CRITICAL, "#dc2626");
        PRIORITY_COLORS.put(AlertPriority.HIGH, "#ea580c");
        PRIORITY_COLORS.put(AlertPriority.MEDIUM, "#ca8a04");
        PRIORITY_COLORS.put(AlertPriority.LOW, "#2563eb");
    }

    private final JavaMailSender mailSender;
    private final OperatorRepository operatorRepository;
    private final CampaignRepository campaignRepository;
    private final AlertEngineConfig.Mail mailConfig;

    public SmtpEmailSender(JavaMailSender mailSender,
                           OperatorRepository operatorRepository,
                           CampaignRepository campaignRepository,
                           AlertEngineConfig config) {
        this.mailSender = mailSender;
        this.operatorRepository = operatorRepository;
        this.campaignRepository = campaignRepository;
        this.mailConfig = config.getMail();
    }

    @Override
    public void sendAlertEmail(Alert alert) {
        ensureEnabled();

        Operator operator = operatorRepository.findById(alert.getRecipientId())
                .orElseThrow(() -> new ChannelException("No operator " + alert.getRecipientId() + " for alert " + alert.getId()));
        String campaignName = campaignRepository.findById(alert.getCampaignId())
                .map(Campaign::getName)
                .orElse(alert.getCampaignId());

        String subject = String.format("[%s] %s", alert.getPriority(), alert.getTitle());
        send(operator, subject, buildAlertHtml(alert, campaignName));
        log.info("Alert email sent: alert={}, to={}", alert.getId(), operator.getEmail());
    }

    @Override
    public void sendDailySummary(Operator operator, List<Alert> alerts) {
        ensureEnabled();

        String subject = String.format("Daily alert summary: %d new alert%s", alerts.size(), alerts.size() == 1 ? "" : "s");
        send(operator, subject, buildSummaryHtml(operator, alerts));
        log.info("Daily summary sent to {} with {} alerts", operator.getEmail(), alerts.size());
    }

    private void ensureEnabled() {
        if (!mailConfig.isEnabled()) {
            throw new ChannelException("Email channel is disabled");
        }
    }

    private void send(Operator operator, String subject, String html) {
        if (operator.getEmail() == null || operator.getEmail().isBlank()) {
            throw new ChannelException("Operator " + operator.getId() + " has no email address");
        }
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, "UTF-8");
            helper.setFrom(mailConfig.getFrom());
            helper.setTo(operator.getEmail());
            helper.setSubject(subject);
            helper.setText(html, true);
            mailSender.send(message);
        } catch (MessagingException | MailException e) {
            throw new ChannelException("Failed to send email to " + operator.getEmail(), e);
        }
    }

    String buildAlertHtml(Alert alert, String campaignName) {
        String color = PRIORITY_COLORS.get(alert.getPriority());
        String link = mailConfig.getDashboardUrl() + "/alerts/" + alert.getId();

        StringBuilder html = new StringBuilder();
        html.append("<div style=\"font-family:Arial,sans-serif;max-width:600px\">")
                .append("<div style=\"border-left:4px solid ").append(color).append(";padding:12px\">")
                .append("<span style=\"color:").append(color).append(";font-weight:bold\">")
                .append(alert.getPriority()).append("</span>")
                .append("<h2>").append(escape(alert.getTitle())).append("</h2>")
                .append("<p><strong>Campaign:</strong> ").append(escape(campaignName)).append("</p>")
                .append("<p>").append(escape(alert.getMessage())).append("</p>")
                .append("<table>")
                .append(row("Current value", format(alert.getCurrentValue())))
                .append(row("Threshold", format(alert.getThreshold())));
        if (alert.getPreviousValue() != null) {
            html.append(row("Previous value", format(alert.getPreviousValue())));
        }
        html.append("</table>")
                .append("<p><a href=\"").append(escape(link)).append("\">View alert</a></p>")
                .append("</div></div>");
        return html.toString();
    }

    String buildSummaryHtml(Operator operator, List<Alert> alerts) {
        StringBuilder html = new StringBuilder();
        html.append("<div style=\"font-family:Arial,sans-serif;max-width:600px\">")
                .append("<p>Hello ").append(escape(operator.getName())).append(",</p>")
                .append("<p>").append(alerts.size()).append(" alerts were raised in the last 24 hours.</p>")
                .append("<table>");
        for (Alert alert : alerts) {
            html.append("<tr><td style=\"color:").append(PRIORITY_COLORS.get(alert.getPriority())).append("\">")
                    .append(alert.getPriority()).append("</td><td>")
                    .append(escape(alert.getTitle())).append("</td></tr>");
        }
        html.append("</table>")
                .append("<p><a href=\"").append(escape(mailConfig.getDashboardUrl() + "/alerts")).append("\">Open alerts</a></p>")
                .append("</div>");
        return html.toString();
    }

    private static String row(String label, String value) {
        return "<tr><td>" + label + "</td><td><strong>" + value + "</strong></td></tr>";
    }

    private static String format(double value) {
        return String.format("%.2f", value);
    }

    private static String escape(String text) {
        return text == null ? "" : HtmlUtils.htmlEscape(text);
    }
}
