package com.authplatform.validitysvc.infrastructure.mail;

import com.authplatform.validitysvc.config.ValidityPolicy;
import com.authplatform.validitysvc.domain.port.MailTransport;
import com.authplatform.validitysvc.shared.security.SecurityUtils;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

@Component
@RequiredArgsConstructor
@Slf4j
public class SmtpMailTransport implements MailTransport {

    private final JavaMailSender mailSender;
    private final ValidityPolicy policy;
    private final SecurityUtils securityUtils;

    @Override
    public boolean send(String address, String subject, String htmlBody, String textBody) {
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, StandardCharsets.UTF_8.name());
            helper.setFrom(policy.mailFrom());
            helper.setTo(address);
            helper.setSubject(subject);
            helper.setText(textBody, htmlBody);
            mailSender.send(message);
            log.debug("Renewal notice sent to {}", securityUtils.maskEmail(address));
            return true;
        } catch (MessagingException | MailException e) {
            log.warn("SMTP delivery to {} failed: {}", securityUtils.maskEmail(address), e.getMessage());
            return false;
        }
    }
}
