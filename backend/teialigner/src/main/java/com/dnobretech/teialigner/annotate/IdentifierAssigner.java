package com.dnobretech.teialigner.annotate;

import com.dnobretech.teialigner.align.AlignedCorrespondence;
import com.dnobretech.teialigner.align.Participant;
import com.dnobretech.teialigner.exception.IdentifierCollisionException;
import com.dnobretech.teialigner.tei.TeiDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Mints one group identifier per correspondence and one identifier per participant.
 * Every new identifier is checked against those already minted and the xml:ids
 * present in either document.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IdentifierAssigner {

    private final IdentifierGenerator generator;

    public List<AlignmentGroup> assign(List<AlignedCorrespondence> correspondences,
                                       TeiDocument source, TeiDocument target) {
        Set<String> taken = new HashSet<>(source.existingIds());
        taken.addAll(target.existingIds());

        List<AlignmentGroup> groups = new ArrayList<>(correspondences.size());
        for (AlignedCorrespondence c : correspondences) {
            String groupId = mint(taken);
            List<IdentifiedParticipant> participants = new ArrayList<>(c.source().size() + c.target().size());
            for (Participant p : c.source()) participants.add(new IdentifiedParticipant(p, mint(taken)));
            for (Participant p : c.target()) participants.add(new IdentifiedParticipant(p, mint(taken)));
            groups.add(new AlignmentGroup(groupId, participants, c.score(), c.granularity()));
        }
        log.debug("IdentifierAssigner: {} groups, {} identifiers", groups.size(),
                groups.stream().mapToInt(g -> g.participants().size() + 1).sum());
        return groups;
    }

    private String mint(Set<String> taken) {
        String id = generator.next();
        if (id == null || id.isBlank() || !taken.add(id)) {
            log.error("Identifier collision on '{}'", id);
            throw new IdentifierCollisionException(id);
        }
        return id;
    }
}
