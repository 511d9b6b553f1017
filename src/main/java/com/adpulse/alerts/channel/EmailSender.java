package com.adpulse.alerts.channel;

import com.adpulse.alerts.model.Alert;
import com.adpulse.alerts.model.Operator;

import java.util.List;

/**
 * Outbound email. Both methods throw {@link com.adpulse.alerts.exception.ChannelException}
 * when the message was not handed to the mail relay.
 */
public interface EmailSender {

    void sendAlertEmail(Alert alert);

    void sendDailySummary(Operator operator, List<Alert> alerts);
}
