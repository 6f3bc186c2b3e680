package com.mouse.keeper.service;

import com.mouse.keeper.config.KeeperProperties;
import com.mouse.keeper.enums.FailureKind;
import com.mouse.keeper.model.Site;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether an upstream outcome is delivered to the caller, blamed on the account,
 * or blamed on the site. Status codes and body signatures come from
 * {@code keeper.router.classifier}.
 */
@Component
public class UpstreamFailureClassifier {

    private final KeeperProperties.Classifier rules;

    public UpstreamFailureClassifier(KeeperProperties properties) {
        this.rules = properties.getRouter().getClassifier();
    }

    /**
     * @param body decoded error body; ignored below 400
     */
    public FailureKind classify(Site site, int status, String contentType, String body) {
        if (contentType != null && contentType.toLowerCase(Locale.ROOT).contains("text/html")) {
            return FailureKind.CHALLENGE_BLOCKED;
        }
        if (status < 400) {
            return FailureKind.DELIVERED;
        }

        String text = body == null ? "" : body.toLowerCase(Locale.ROOT);
        if (containsAny(text, rules.getBlockSignatures())) {
            return FailureKind.CHALLENGE_BLOCKED;
        }
        if (status >= 500 && text.isBlank() && site.isRequiresChallenge() && rules.isEmptyServerErrorIsBlock()) {
            return FailureKind.CHALLENGE_BLOCKED;
        }
        if (containsAny(text, rules.getQuotaSignatures())) {
            return FailureKind.QUOTA_EXHAUSTED;
        }
        if (rules.getAuthStatusCodes().contains(status)) {
            return FailureKind.AUTH_REJECTED;
        }
        if (rules.getRateLimitStatusCodes().contains(status) || containsAny(text, rules.getRateLimitSignatures())) {
            return FailureKind.RATE_LIMITED;
        }
        if (status >= 500) {
            return FailureKind.SERVER_ERROR;
        }
        return FailureKind.DELIVERED;
    }

    /**
     * Connection-level failures belong to the site. A read timeout on an established
     * connection is the upstream being slow for this call and counts against the account.
     */
    public FailureKind classify(IOException e) {
        if (e instanceof ConnectException || e instanceof UnknownHostException || e instanceof NoRouteToHostException) {
            return FailureKind.SITE_UNREACHABLE;
        }
        if (e instanceof SocketTimeoutException) {
            String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
            return message.contains("connect") ? FailureKind.SITE_UNREACHABLE : FailureKind.SERVER_ERROR;
        }
        return FailureKind.SITE_UNREACHABLE;
    }

    private static boolean containsAny(String text, List<String> signatures) {
        if (text.isEmpty() || signatures == null) {
            return false;
        }
        for (String signature : signatures) {
            if (!signature.isEmpty() && text.contains(signature.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
