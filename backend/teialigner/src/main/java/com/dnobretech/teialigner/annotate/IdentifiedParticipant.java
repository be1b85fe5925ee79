package com.dnobretech.teialigner.annotate;

import com.dnobretech.teialigner.align.Participant;

public record IdentifiedParticipant(Participant participant, String id) {
}
