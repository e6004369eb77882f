package com.trustplatform.response.service;

import com.trustplatform.response.incident.ActionRecord;

import java.util.List;

/** A dispatched action's record together with the incidents it was appended to. */
record DispatchOutcome(ActionRecord record, List<String> incidentIds) {
}
