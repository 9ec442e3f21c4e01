package de.conciso.plantdiag.conversation;

import de.conciso.plantdiag.model.CandidateDisease;

public record Verdict(CandidateDisease disease, StopReason reason) {}
