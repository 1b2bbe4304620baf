package org.gridiron.service;

import dev.langchain4j.model.chat.ChatModel;
import org.gridiron.Fixtures;
import org.gridiron.lineup.EnrichmentFeed;
import org.gridiron.lineup.ExternalProjection;
import org.gridiron.lineup.LineupFailure;
import org.gridiron.lineup.LineupOptimizer;
import org.gridiron.lineup.LineupStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LineupServiceTest {

    private static final String LEAGUE = "423.l.12345";
    private static final String TEAM = "423.l.12345.t.3";

    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static FeedSource feed(EnrichmentFeed result) {
        return new FeedSource() {
            @Override
            public String name() {
                return result.source();
            }

            @Override
            public EnrichmentFeed fetchFeed(Integer week) {
                return result;
            }
        };
    }

    private static FeedSource failingFeed() {
        return new FeedSource() {
            @Override
            public String name() {
                return "sleeper";
            }

            @Override
            public EnrichmentFeed fetchFeed(Integer week) throws IOException {
                throw new IOException("Sleeper API error 503");
            }
        };
    }

    private static FakeYahooApi yahoo() {
        return new FakeYahooApi()
                .teamKey(TEAM)
                .respond("team/" + TEAM + "/roster", Fixtures.object("yahoo_roster.json"))
                .respond("league/" + LEAGUE + "/settings", Fixtures.object("yahoo_settings_wrapped.json"));
    }

    private LineupService service(YahooApi yahoo, List<FeedSource> feeds, ChatModel model) {
        return new LineupService(yahoo, feeds, LineupOptimizer.withDefaults(), new LineupInsightService(model), executor);
    }

    @Test
    void combinesRosterSettingsAndFeeds() throws IOException {
        EnrichmentFeed sleeper = new EnrichmentFeed("sleeper", List.of(
                new ExternalProjection("Travis Kelce", "KC", 12.0, 8.0, 19.0, 40, "LV", 6.0, "Neutral vs LV")));
        FakeYahooApi yahoo = yahoo();

        LineupReport report = service(yahoo, List.of(feed(sleeper)), null).build(LEAGUE, TEAM, 5, "balanced", false);

        assertThat(report.result().status()).isEqualTo(LineupStatus.OK);
        assertThat(report.result().starters().get("TE").player().getProjectionB()).isEqualTo(12.0);
        assertThat(report.week()).isEqualTo(5);
        assertThat(report.insight()).isNull();
        assertThat(yahoo.calls()).contains("team/" + TEAM + "/roster;week=5", "league/" + LEAGUE + "/settings");
    }

    @Test
    void settingsOutageFallsBackToDefaultTemplate() throws IOException {
        FakeYahooApi yahoo = yahoo().fail("league/", new IOException("Yahoo API error 500"));

        LineupReport report = service(yahoo, List.of(), null).build(LEAGUE, TEAM, null, "floor", false);

        assertThat(report.result().status()).isEqualTo(LineupStatus.OK_WITH_WARNINGS);
        assertThat(report.result().hasIssue(LineupFailure.SETTINGS_UNAVAILABLE)).isTrue();
    }

    @Test
    void feedOutageOnlyLosesEnrichment() throws IOException {
        LineupReport report = service(yahoo(), List.of(failingFeed()), null).build(LEAGUE, TEAM, null, "ceiling", false);

        assertThat(report.result().status()).isEqualTo(LineupStatus.OK);
        assertThat(report.result().dataQuality().playersWithMatchupData()).isZero();
    }

    @Test
    void rosterOutageIsPropagated() {
        FakeYahooApi yahoo = yahoo().fail("team/", new IOException("RATE_LIMITED"));

        assertThatThrownBy(() -> service(yahoo, List.of(), null).build(LEAGUE, TEAM, null, "balanced", false))
                .isInstanceOf(IOException.class)
                .hasMessage("RATE_LIMITED");
    }

    @Test
    void insightIsAddedOnlyWhenRequested() throws IOException {
        ChatModel model = new ChatModel() {
            @Override
            public String chat(String userMessage) {
                return "  Start Josh Allen over Mahomes.  ";
            }
        };

        LineupService service = service(yahoo(), List.of(), model);

        assertThat(service.build(LEAGUE, TEAM, null, "balanced", true).insight()).isEqualTo("Start Josh Allen over Mahomes.");
        assertThat(service.build(LEAGUE, TEAM, null, "balanced", false).insight()).isNull();
    }

    @Test
    void noInsightForFailedLineup() throws IOException {
        ChatModel model = new ChatModel() {
            @Override
            public String chat(String userMessage) {
                throw new AssertionError("model must not be called for a failed lineup");
            }
        };

        LineupReport report = service(yahoo(), List.of(), model).build(LEAGUE, TEAM, null, "nonsense", true);

        assertThat(report.result().status()).isEqualTo(LineupStatus.ERROR);
        assertThat(report.insight()).isNull();
    }
}
