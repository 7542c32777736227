package com.sanctionsentinel.service.notify;

import java.io.IOException;

public interface EmailSender {
    void send(EmailMessage message) throws IOException;
}
