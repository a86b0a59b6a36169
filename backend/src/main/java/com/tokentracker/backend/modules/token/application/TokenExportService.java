package com.tokentracker.backend.modules.token.application;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

import com.tokentracker.backend.modules.token.domain.TokenRecord;
import com.tokentracker.backend.modules.token.infrastructure.persistence.TokenRecordRepository;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Spreadsheet-friendly CSV of every token: UTF-8 with a byte order mark so Excel picks
 * the right encoding.
 */
@Service
public class TokenExportService {

    private static final Logger log = LoggerFactory.getLogger(TokenExportService.class);

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
    private static final DateTimeFormatter FILE_NAME_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    static final String[] HEADERS = {
            "id", "date", "completion_date", "location", "sub_location", "token", "password",
            "client_name", "contact", "who_will_ship", "contacted_client", "status", "forwarded",
            "charges", "payment_received", "amount_due", "charges_to_executive", "agent_name",
            "executive_name", "margin", "process_by", "agent_payment_applied",
            "executive_payment_applied", "created_at", "updated_at"
    };

    private final TokenRecordRepository tokenRecordRepository;
    private final Clock clock;

    public TokenExportService(TokenRecordRepository tokenRecordRepository, Clock clock) {
        this.tokenRecordRepository = tokenRecordRepository;
        this.clock = clock;
    }

    public String exportFileName() {
        return "tokens_export_" + LocalDateTime.now(clock).format(FILE_NAME_TIMESTAMP) + ".csv";
    }

    @Transactional(readOnly = true)
    public byte[] exportCsv() {
        List<TokenRecord> records = tokenRecordRepository.findAllByOrderByIdAsc();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(UTF8_BOM);

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(HEADERS)
                .build();

        try (Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (TokenRecord record : records) {
                printer.printRecord(
                        record.getId(),
                        record.getDate(),
                        record.getCompletionDate(),
                        record.getLocation(),
                        record.getSubLocation(),
                        record.getToken(),
                        record.getPassword(),
                        record.getClientName(),
                        record.getContact(),
                        record.getWhoWillShip(),
                        record.getContactedClient(),
                        record.getStatus(),
                        record.getForwarded(),
                        plain(record.getCharges()),
                        plain(record.getPaymentReceived()),
                        plain(record.getAmountDue()),
                        plain(record.getChargesToExecutive()),
                        record.getAgentName(),
                        record.getExecutiveName(),
                        plain(record.getMargin()),
                        record.getProcessBy(),
                        record.isAgentPaymentApplied(),
                        record.isExecutivePaymentApplied(),
                        record.getCreatedAt(),
                        record.getUpdatedAt()
                );
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write token export", e);
        }

        log.info("Exported {} token(s) to CSV", records.size());
        return out.toByteArray();
    }

    private static String plain(BigDecimal value) {
        return value == null ? null : value.toPlainString();
    }
}
