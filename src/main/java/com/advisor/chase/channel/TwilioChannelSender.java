package com.advisor.chase.channel;

import com.advisor.chase.config.TwilioChannelConfig;
import com.advisor.chase.model.Channel;
import com.advisor.chase.model.Recipient;
import com.advisor.chase.model.SendOutcome;
import com.advisor.chase.model.Tone;
import com.twilio.Twilio;
import com.twilio.exception.ApiConnectionException;
import com.twilio.exception.ApiException;
import com.twilio.rest.api.v2010.account.Call;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import com.twilio.type.Twiml;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

/**
 * SMS through the Twilio Messages API and phone chases through the Calls API with a
 * spoken TwiML script. Email has no provider wired in and, like every channel while
 * Twilio is disabled, is simulated: logged and reported as delivered.
 */
@Component
public class TwilioChannelSender implements ChannelSender {

    private static final Logger log = LoggerFactory.getLogger(TwilioChannelSender.class);

    private final TwilioChannelConfig config;

    public TwilioChannelSender(TwilioChannelConfig config) {
        this.config = config;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio channel sender initialized, from={}", config.getFromNumber());
        } else {
            log.info("Twilio channel sender is DISABLED, all channels run in simulation mode.");
        }
    }

    @Override
    public SendOutcome send(Recipient recipient, Channel channel, Tone tone, String message) {
        if (!config.isEnabled() || channel == Channel.EMAIL) {
            return simulate(recipient, channel, tone, message);
        }

        try {
            PhoneNumber to = new PhoneNumber(recipient.getAddress());
            PhoneNumber from = new PhoneNumber(config.getFromNumber());
            String sid;
            if (channel == Channel.SMS) {
                sid = Message.creator(to, from, message).create().getSid();
            } else {
                sid = Call.creator(to, from, new Twiml(callScript(message))).create().getSid();
            }
            log.info("Twilio {} sent to {}, sid={}", channel, recipient.getTargetId(), sid);
            return SendOutcome.SUCCESS;
        } catch (ApiConnectionException e) {
            log.warn("Twilio unreachable for {} to {}: {}", channel, recipient.getTargetId(), e.getMessage());
            return SendOutcome.TRANSIENT_CHANNEL_ERROR;
        } catch (ApiException e) {
            SendOutcome outcome = classify(e.getStatusCode());
            log.warn("Twilio rejected {} to {} (status={}, code={}): {} -> {}",
                    channel, recipient.getTargetId(), e.getStatusCode(), e.getCode(), e.getMessage(), outcome);
            return outcome;
        }
    }

    /**
     * Rate limiting and server errors can succeed later; any other API rejection
     * (invalid number, unverified destination, bad request) will not.
     */
    static SendOutcome classify(Integer statusCode) {
        if (statusCode == null) {
            return SendOutcome.TRANSIENT_CHANNEL_ERROR;
        }
        if (statusCode == 429 || statusCode >= 500) {
            return SendOutcome.TRANSIENT_CHANNEL_ERROR;
        }
        return SendOutcome.PERMANENT_CHANNEL_ERROR;
    }

    String callScript(String message) {
        return "<Response><Say voice=\"" + HtmlUtils.htmlEscape(config.getVoice()) + "\">"
                + HtmlUtils.htmlEscape(message)
                + "</Say></Response>";
    }

    private SendOutcome simulate(Recipient recipient, Channel channel, Tone tone, String message) {
        log.info("[SIMULATED {}] to={} <{}> tone={} message=\"{}\"",
                channel, recipient.getName(), recipient.getAddress(), tone, message);
        return SendOutcome.SUCCESS;
    }
}
