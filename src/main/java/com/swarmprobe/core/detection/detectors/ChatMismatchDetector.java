package com.swarmprobe.core.detection.detectors;

import com.swarmprobe.core.config.SwarmProbeProperties;
import com.swarmprobe.core.detection.ConsecutiveGate;
import com.swarmprobe.core.detection.Detector;
import com.swarmprobe.core.detection.Finding;
import com.swarmprobe.core.detection.SwarmSnapshot;
import com.swarmprobe.core.detection.ViolationGate;
import com.swarmprobe.core.model.ChatObservation;
import com.swarmprobe.core.model.Frequency;
import com.swarmprobe.core.model.Issue;
import com.swarmprobe.core.model.IssueArea;
import com.swarmprobe.core.model.IssueEvidence;
import com.swarmprobe.core.model.MemberSnapshot;
import com.swarmprobe.core.model.Severity;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Two members whose chat observations were taken close together disagree about the
 * messages on the broadcast channel within the time range both windows cover. A pair of chat
 * observations counts once.
 */
public class ChatMismatchDetector implements Detector {

    public static final String NAME = "chat-mismatch";

    private final SwarmProbeProperties.Detection config;
    private Map<String, String> counted = new HashMap<>();

    public ChatMismatchDetector(SwarmProbeProperties.Detection config) {
        this.config = config;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ViolationGate newGate() {
        return new ConsecutiveGate(2);
    }

    @Override
    public Optional<Finding> evaluate(SwarmSnapshot snapshot) {
        var observers = snapshot.registered().stream()
                .filter(m -> m.lastChatObserveAt() != null && m.chatWindowStart() != null)
                .sorted(Comparator.comparing(MemberSnapshot::memberId))
                .toList();

        var seen = new HashMap<String, String>();
        Finding finding = null;
        for (int i = 0; i < observers.size(); i++) {
            for (int j = i + 1; j < observers.size(); j++) {
                var a = observers.get(i);
                var b = observers.get(j);
                if (DetectorSupport.millisBetween(a.lastChatObserveAt(), b.lastChatObserveAt()) > config.getChatSkewMs()) {
                    continue;
                }
                var pair = a.memberId() + "|" + b.memberId();
                var observations = a.lastChatObserveAt() + "|" + b.lastChatObserveAt();
                seen.put(pair, observations);
                if (finding != null || observations.equals(counted.get(pair))) {
                    continue;
                }
                var from = later(a.chatWindowStart(), b.chatWindowStart());
                var to = earlier(a.lastChatObserveAt(), b.lastChatObserveAt());
                if (!from.isBefore(to)) {
                    continue;
                }
                var setA = messagesIn(a, from, to);
                var setB = messagesIn(b, from, to);
                double distance = DetectorSupport.jaccardDistance(setA, setB);
                if (distance > config.getChatJaccardDistance()) {
                    finding = toFinding(a, b, setA, setB, distance);
                }
            }
        }
        counted = seen;
        return Optional.ofNullable(finding);
    }

    private Set<String> messagesIn(MemberSnapshot member, Instant from, Instant to) {
        var channel = config.getChatBroadcastChannel();
        return member.chat().stream()
                .filter(c -> channel.equals(c.channel()))
                .filter(c -> !c.timestamp().isBefore(from) && !c.timestamp().isAfter(to))
                .map(ChatObservation::fingerprint)
                .collect(Collectors.toCollection(HashSet::new));
    }

    private Finding toFinding(MemberSnapshot a, MemberSnapshot b, Set<String> setA, Set<String> setB,
                              double distance) {
        var onlyA = setA.stream().filter(m -> !setB.contains(m)).sorted().toList();
        var onlyB = setB.stream().filter(m -> !setA.contains(m)).sorted().toList();
        var channel = config.getChatBroadcastChannel();
        var issue = new Issue(
                IssueArea.CHAT,
                "Chat message mismatch between members on " + channel,
                NAME,
                "All members should see the same messages on the " + channel + " channel",
                "Members %s and %s disagree on %s chat (Jaccard distance %s)".formatted(
                        a.memberId(), b.memberId(), channel, DetectorSupport.fmt(distance)),
                List.of("Spawn multiple members in the same room",
                        "Have members send chat messages on the " + channel + " channel",
                        "Observe chat from two members within a few seconds of each other",
                        "Compare the message sets over the shared time range"),
                Severity.MAJOR,
                Frequency.SOMETIMES,
                IssueEvidence.of(
                        List.of(a.memberId(), b.memberId()),
                        List.of(a.lastChatObserveAt(), b.lastChatObserveAt()),
                        List.of("Member %s unique: %s".formatted(a.memberId(), String.join(", ", onlyA)),
                                "Member %s unique: %s".formatted(b.memberId(), String.join(", ", onlyB))))
                        .withStateTable(DetectorSupport.rows(a, b)));
        return new Finding(issue, channel);
    }

    private static Instant later(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }

    private static Instant earlier(Instant a, Instant b) {
        return a.isBefore(b) ? a : b;
    }
}
