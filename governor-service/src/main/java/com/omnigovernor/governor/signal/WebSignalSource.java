package com.omnigovernor.governor.signal;

import com.omnigovernor.common.model.Signal;
import com.omnigovernor.governor.config.GovernorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Web-text {@link SignalSource}.
 *
 * <p>Every provider is fetched independently with its own timeout. A body qualifies when its
 * comparative sentiment exceeds the threshold and it contains a {@code $TICKER} token; the
 * first token wins. Provider failures are absorbed with an empty contribution.
 */
@Component
public class WebSignalSource implements SignalSource {

    private static final Logger log = LoggerFactory.getLogger(WebSignalSource.class);

    private static final Pattern TICKER = Pattern.compile("\\$([A-Z]+)");

    private final WebClient signalWebClient;
    private final SentimentAnalyzer sentimentAnalyzer;
    private final List<String> providers;
    private final Duration timeout;
    private final double threshold;

    public WebSignalSource(WebClient signalWebClient, SentimentAnalyzer sentimentAnalyzer,
                           GovernorProperties properties) {
        this.signalWebClient   = signalWebClient;
        this.sentimentAnalyzer = sentimentAnalyzer;
        this.providers         = properties.signals().providers();
        this.timeout           = properties.signals().timeout();
        this.threshold         = properties.signals().threshold();
    }

    @Override
    public Mono<List<Signal>> collect() {
        return Flux.fromIterable(providers)
            .flatMapSequential(this::fetch)
            .collectList()
            .doOnNext(signals -> log.debug("Signals collected. providers={} signals={}",
                                           providers.size(), signals.size()));
    }

    private Mono<Signal> fetch(String url) {
        return signalWebClient.get()
            .uri(url)
            .retrieve()
            .bodyToMono(String.class)
            .timeout(timeout)
            .flatMap(text -> Mono.justOrEmpty(extract(text)))
            .onErrorResume(e -> {
                log.debug("Signal provider skipped. url={} reason={}", url, e.getMessage());
                return Mono.empty();
            });
    }

    /** At most one signal per body. */
    Optional<Signal> extract(String text) {
        if (text == null) {
            return Optional.empty();
        }
        double strength = sentimentAnalyzer.comparative(text);
        if (strength <= threshold) {
            return Optional.empty();
        }
        Matcher matcher = TICKER.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(new Signal(matcher.group(1), strength));
    }
}
