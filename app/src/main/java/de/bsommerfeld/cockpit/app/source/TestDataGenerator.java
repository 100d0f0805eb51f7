package de.bsommerfeld.cockpit.app.source;

import de.bsommerfeld.cockpit.core.domain.ChecksStatus;
import de.bsommerfeld.cockpit.core.domain.Incident;
import de.bsommerfeld.cockpit.core.domain.IncidentStatus;
import de.bsommerfeld.cockpit.core.domain.PrState;
import de.bsommerfeld.cockpit.core.domain.Priority;
import de.bsommerfeld.cockpit.core.domain.PullRequest;
import de.bsommerfeld.cockpit.core.domain.Reviewer;
import de.bsommerfeld.cockpit.core.domain.Severity;
import de.bsommerfeld.cockpit.core.domain.StatusCategory;
import de.bsommerfeld.cockpit.core.domain.Ticket;
import de.bsommerfeld.cockpit.core.domain.TicketStatus;
import de.bsommerfeld.cockpit.core.domain.User;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.UUID;

/**
 * Generates plausible tickets, pull requests and incidents for TEST mode.
 *
 * <h3>What the output looks like</h3>
 * <ul>
 * <li><strong>Pull requests</strong>: spread over four repositories, last
 * activity anywhere in the past week so roughly half of them are stale under
 * the default 48 hour threshold. Every third PR requests a review from
 * {@link #MANAGER}.</li>
 * <li><strong>Tickets</strong>: keys {@code CORE-1..n}, mixed status
 * categories and priorities, updated within the last ten days.</li>
 * <li><strong>Incidents</strong>: one firing incident for a random service
 * with a random severity, started up to two hours ago.</li>
 * </ul>
 *
 * <p>
 * All generators are pure factories; callers pass the reference instant so
 * results line up with the injected clock.
 */
public final class TestDataGenerator {

    private static final Random RND = new Random();

    /** Reviewer identity used in generated data; matches {@code user-id = "u-em"}. */
    public static final User MANAGER = new User("u-em", "Erin Manager", "erin@example.com", null);

    // --- Data Pools ---

    private static final String[] REPOSITORIES = { "core-api", "web-app", "billing", "infra" };

    private static final String[] PR_TITLES = { "Fix token refresh race", "Add audit log export",
            "Bump dependencies", "Migrate invoices to v2 schema", "Drop legacy feature flag", "Tune connection pool",
            "Retry webhook delivery", "Split settings page" };

    private static final String[] TICKET_SUMMARIES = { "Login redirect loops on Safari", "Invoice PDF missing VAT id",
            "Search returns stale results", "Nightly export times out", "Onboarding email not sent",
            "Dashboard widget shows wrong currency", "Crash when uploading large avatar" };

    private static final String[] SERVICES = { "checkout", "auth", "search", "notifications", "billing" };

    private static final String[] ALERTS = { "Error rate above 5%", "p99 latency above 2s", "Pod restart loop",
            "Queue backlog growing", "Disk usage above 90%" };

    private static final User[] PEOPLE = {
            new User("u-ana", "Ana Ortiz"),
            new User("u-ben", "Ben Okafor"),
            new User("u-chen", "Chen Wei"),
            new User("u-dora", "Dora Lind"),
    };

    private static final TicketStatus[] TICKET_STATUSES = {
            new TicketStatus("To Do", StatusCategory.TODO),
            new TicketStatus("In Progress", StatusCategory.IN_PROGRESS),
            new TicketStatus("In Review", StatusCategory.IN_PROGRESS),
            new TicketStatus("Done", StatusCategory.DONE),
    };

    private TestDataGenerator() {
    }

    public static List<PullRequest> generatePullRequests(int count, Instant now) {
        List<PullRequest> list = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            String repository = REPOSITORIES[i % REPOSITORIES.length];
            User author = randomElement(PEOPLE);
            List<Reviewer> reviewers = new ArrayList<>();
            reviewers.add(new Reviewer(randomElement(PEOPLE), RND.nextBoolean()));
            if (i % 3 == 0)
                reviewers.add(new Reviewer(MANAGER, false));

            Instant updated = now.minus(Duration.ofMinutes(RND.nextInt(7 * 24 * 60)));
            Instant created = updated.minus(Duration.ofHours(1 + RND.nextInt(72)));
            String id = String.valueOf(100 + i);
            list.add(new PullRequest(id, repository, randomElement(PR_TITLES),
                    "Generated pull request for offline mode.", i % 5 == 0 ? PrState.DRAFT : PrState.OPEN, author,
                    reviewers, "feature/" + id, "main", randomElement(ChecksStatus.values()), updated, created,
                    "https://git.example.com/" + repository + "/pull/" + id));
        }
        return list;
    }

    public static List<Ticket> generateTickets(int count, Instant now) {
        List<Ticket> list = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            String key = "CORE-" + i;
            Instant updated = now.minus(Duration.ofMinutes(RND.nextInt(10 * 24 * 60)));
            list.add(new Ticket(
                    "1000" + i,
                    key,
                    TICKET_SUMMARIES[(i - 1) % TICKET_SUMMARIES.length],
                    "Reported via support. See " + key + " for the reproduction steps.",
                    randomElement(TICKET_STATUSES),
                    RND.nextInt(4) == 0 ? null : randomElement(PEOPLE),
                    MANAGER,
                    randomElement(Priority.values()),
                    List.of("generated"),
                    updated,
                    updated.minus(Duration.ofDays(1 + RND.nextInt(30)))));
        }
        return list;
    }

    public static Incident generateIncident(Instant now) {
        String service = randomElement(SERVICES);
        return new Incident(
                "INC-" + UUID.randomUUID().toString().substring(0, 8),
                service,
                randomElement(Severity.values()),
                IncidentStatus.FIRING,
                now.minus(Duration.ofMinutes(RND.nextInt(120))),
                null,
                randomElement(ALERTS) + " on " + service,
                "https://runbooks.example.com/" + service);
    }

    private static <T> T randomElement(T[] array) {
        return array[RND.nextInt(array.length)];
    }
}
