package membership.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * One payment event from the transactions sheet.
 *
 * <p>A transaction with a non-null {@code processed} date has been consumed and is
 * never reconsidered.
 */
public record Transaction(
        String emailAddress,
        String firstName,
        String lastName,
        String phone,
        String payment,
        String directory,
        String payableStatus,
        LocalDate processed) {

    public static final String EMAIL_ADDRESS = "Email Address";
    public static final String FIRST_NAME = "First Name";
    public static final String LAST_NAME = "Last Name";
    public static final String PHONE = "Phone";
    public static final String PAYMENT = "Payment";
    public static final String DIRECTORY = "Directory";
    public static final String PAYABLE_STATUS = "Payable Status";
    public static final String PROCESSED = "Processed";

    public Transaction {
        emailAddress = emailAddress == null ? "" : emailAddress.trim();
        firstName = firstName == null ? "" : firstName.trim();
        lastName = lastName == null ? "" : lastName.trim();
        phone = phone == null ? "" : phone.trim();
        payment = payment == null ? "" : payment;
        directory = directory == null ? "" : directory;
        payableStatus = payableStatus == null ? "" : payableStatus;
    }

    public boolean isProcessed() {
        return processed != null;
    }

    /** A transaction is payable once its status starts with "paid", ignoring case. */
    public boolean isPaid() {
        return payableStatus.trim().toLowerCase(Locale.ROOT).startsWith("paid");
    }

    public Transaction markProcessed(LocalDate date) {
        return new Transaction(emailAddress, firstName, lastName, phone, payment, directory,
                payableStatus, date);
    }

    /**
     * Returns the transaction's columns keyed by their stored names. An unprocessed
     * transaction has an empty {@code Processed} value.
     *
     * @return unmodifiable row map
     */
    public Map<String, String> toRow() {
        Map<String, String> row = new LinkedHashMap<>();
        row.put(EMAIL_ADDRESS, emailAddress);
        row.put(FIRST_NAME, firstName);
        row.put(LAST_NAME, lastName);
        row.put(PHONE, phone);
        row.put(PAYMENT, payment);
        row.put(DIRECTORY, directory);
        row.put(PAYABLE_STATUS, payableStatus);
        row.put(PROCESSED, processed == null ? "" : processed.toString());
        return Collections.unmodifiableMap(row);
    }
}
