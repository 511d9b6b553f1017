package com.adpulse.alerts.channel;

import com.adpulse.alerts.model.Alert;

public interface ChatPoster {

    /**
     * Post the alert as a system message in the conversation between the campaign's manager and
     * its advertiser.
     *
     * @return id of the conversation the message landed in
     * @throws com.adpulse.alerts.exception.ChannelException if there is no such conversation or the
     *                                                       message could not be stored
     */
    String postSystemMessage(String campaignId, Alert alert);
}
