package com.parley.core.mailbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.parley.core.protocol.ProtocolParseException;

public class MailboxCodec {

    private final ObjectReader reader;

    public MailboxCodec(ObjectMapper objectMapper) {
        this.reader = objectMapper.readerFor(MailboxCommand.class)
                .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public MailboxCommand decode(String json) {
        if (json == null || json.isBlank()) {
            throw new ProtocolParseException("Empty mailbox file");
        }
        try {
            MailboxCommand command = reader.readValue(json);
            if (command == null) {
                throw new ProtocolParseException("Mailbox file holds no command");
            }
            return command;
        } catch (InvalidTypeIdException e) {
            if (e.getTypeId() == null) {
                throw new ProtocolParseException("Mailbox command without a type", e);
            }
            throw new ProtocolParseException("Unknown mailbox command type '" + e.getTypeId() + "'", e);
        } catch (JsonProcessingException e) {
            throw new ProtocolParseException("Malformed mailbox command: " + e.getOriginalMessage(), e);
        }
    }
}
