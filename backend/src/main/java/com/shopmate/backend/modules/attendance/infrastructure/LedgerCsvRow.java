package com.shopmate.backend.modules.attendance.infrastructure;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Raw text of one ledger line. Only {@link LedgerRowCodec} turns it into a session.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"card_uid", "member_name", "check_in", "check_out", "hours", "approved"})
record LedgerCsvRow(
        @JsonProperty("card_uid") String cardUid,
        @JsonProperty("member_name") String memberName,
        @JsonProperty("check_in") String checkIn,
        @JsonProperty("check_out") String checkOut,
        @JsonProperty("hours") String hours,
        @JsonProperty("approved") String approved
) {

    static final List<String> COLUMNS = List.of("card_uid", "member_name", "check_in", "check_out", "hours", "approved");
}
