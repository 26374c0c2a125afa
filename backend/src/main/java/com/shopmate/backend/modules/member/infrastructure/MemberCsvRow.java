package com.shopmate.backend.modules.member.infrastructure;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"card_uid", "member_name", "slack_id", "seniority", "lead_slack_id"})
record MemberCsvRow(
        @JsonProperty("card_uid") String cardUid,
        @JsonProperty("member_name") String memberName,
        @JsonProperty("slack_id") String handle,
        @JsonProperty("seniority") String seniority,
        @JsonProperty("lead_slack_id") String leadHandle
) {
}
