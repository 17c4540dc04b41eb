package com.fundrecon.reconciliation.wire;

import com.fundrecon.reconciliation.exception.MalformedMessageException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;

/**
 * Decodes SWIFT MT103 text into a {@link WireMessage}.
 *
 * Extraction is line oriented: for each tag the first line containing the tag
 * marker is taken and the text after the marker, trimmed, becomes the field
 * value. The {@code :32A:} block is split positionally into a YYMMDD value date,
 * a three letter currency and an amount written with a decimal comma.
 *
 * Only structure is checked here. Amount sign and currency code validity are
 * the caller's concern.
 */
@Slf4j
public class WireMessageParser {

    private static final DateTimeFormatter VALUE_DATE_FORMAT =
        DateTimeFormatter.ofPattern("uuMMdd").withResolverStyle(ResolverStyle.STRICT);

    private static final int DATE_LENGTH = 6;
    private static final int CURRENCY_END = 9;

    public WireMessage parse(String rawMessage) {
        if (rawMessage == null || rawMessage.isBlank()) {
            throw new MalformedMessageException("Wire message is empty");
        }

        String[] lines = rawMessage.split("\\r?\\n");

        String senderReference = extractField(lines, WireTag.SENDER_REFERENCE);
        String valueBlock = extractField(lines, WireTag.VALUE_DATE_CURRENCY_AMOUNT);

        if (valueBlock.length() <= CURRENCY_END) {
            throw new MalformedMessageException(
                "Field :32A: too short for date, currency and amount: '" + valueBlock + "'");
        }

        WireMessage message = WireMessage.builder()
            .senderReference(senderReference)
            .valueDate(parseValueDate(valueBlock.substring(0, DATE_LENGTH)))
            .currency(valueBlock.substring(DATE_LENGTH, CURRENCY_END))
            .amount(parseAmount(valueBlock.substring(CURRENCY_END)))
            .orderingParty(extractField(lines, WireTag.ORDERING_CUSTOMER))
            .beneficiaryParty(extractField(lines, WireTag.BENEFICIARY_CUSTOMER))
            .remittanceInfo(extractField(lines, WireTag.REMITTANCE_INFORMATION))
            .senderToReceiverInfo(extractField(lines, WireTag.SENDER_TO_RECEIVER_INFORMATION))
            .build();

        log.debug("Parsed wire message: reference={}, valueDate={}, amount={} {}",
            message.getSenderReference(), message.getValueDate(), message.getAmount(), message.getCurrency());

        return message;
    }

    private String extractField(String[] lines, WireTag tag) {
        for (String marker : tag.getMarkers()) {
            Optional<String> value = findValue(lines, marker);
            if (value.isPresent()) {
                return value.get();
            }
        }
        if (tag.isRequired()) {
            throw new MalformedMessageException(
                "Required field " + tag.getMarkers().get(0) + " not found in wire message");
        }
        return "";
    }

    private Optional<String> findValue(String[] lines, String marker) {
        for (String line : lines) {
            int index = line.indexOf(marker);
            if (index >= 0) {
                return Optional.of(line.substring(index + marker.length()).trim());
            }
        }
        return Optional.empty();
    }

    private LocalDate parseValueDate(String text) {
        try {
            return LocalDate.parse(text, VALUE_DATE_FORMAT);
        } catch (DateTimeParseException e) {
            throw new MalformedMessageException("Invalid value date in field :32A: '" + text + "'", e);
        }
    }

    private BigDecimal parseAmount(String text) {
        String normalized = text.trim().replace(',', '.');
        try {
            return new BigDecimal(normalized);
        } catch (NumberFormatException e) {
            throw new MalformedMessageException("Invalid amount in field :32A: '" + text + "'", e);
        }
    }
}
