package com.authplatform.validitysvc.domain.notification;

public record RenewalEmail(String subject, String htmlBody, String textBody) {
}
