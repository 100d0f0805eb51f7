package de.bsommerfeld.cockpit.app.source;

import com.google.inject.AbstractModule;
import de.bsommerfeld.cockpit.core.source.IncidentSource;
import de.bsommerfeld.cockpit.core.source.PullRequestSource;
import de.bsommerfeld.cockpit.core.source.TicketSource;

/**
 * Binds every upstream source to its offline TEST mode counterpart.
 */
public class TestSourceModule extends AbstractModule {

    @Override
    protected void configure() {
        bind(PullRequestSource.class).to(TestPullRequestSource.class);
        bind(TicketSource.class).to(TestTicketSource.class);
        bind(IncidentSource.class).to(TestIncidentSource.class);
    }
}
