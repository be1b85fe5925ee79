package com.dnobretech.teialigner.annotate;

import com.dnobretech.teialigner.align.Granularity;
import com.dnobretech.teialigner.align.Side;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Identifier-bearing form of one retained correspondence. Participants are listed
 * source first, then target, each with its own identifier.
 */
public record AlignmentGroup(String groupId,
                             List<IdentifiedParticipant> participants,
                             double score,
                             Granularity granularity) {

    public AlignmentGroup {
        participants = List.copyOf(participants);
    }

    public List<String> identifiers() {
        return participants.stream().map(IdentifiedParticipant::id).toList();
    }

    public List<IdentifiedParticipant> on(Side side) {
        return participants.stream().filter(p -> p.participant().side() == side).toList();
    }

    // value of the link's target attribute: "#a #b #c"
    public String targets() {
        return participants.stream().map(p -> "#" + p.id()).collect(Collectors.joining(" "));
    }
}
