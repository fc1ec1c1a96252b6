package com.opsdiag.topology.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsdiag.model.Criticality;
import com.opsdiag.model.ServiceNode;
import com.opsdiag.topology.TopologyDocument;
import com.opsdiag.topology.TopologyException;
import com.opsdiag.topology.TopologyModel;
import com.opsdiag.topology.TopologySnapshot;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@ApplicationScoped
public class DefaultTopologyModel implements TopologyModel {

    private static final Logger LOGGER = Logger.getLogger("ENGINE.TopologyModel");

    static final String CLASSPATH_DOCUMENT = "topology.json";

    private final AtomicReference<TopologySnapshot> current = new AtomicReference<>(TopologySnapshot.empty());
    private final AtomicLong versions = new AtomicLong();

    @Inject
    ObjectMapper mapper;

    @ConfigProperty(name = "engine.topology.path")
    Optional<String> documentPath = Optional.empty();

    @PostConstruct
    void init() {
        Optional<TopologyDocument> document = loadStartupDocument();
        document.ifPresent(this::reload);
        LOGGER.infov(
                "[INIT] DefaultTopologyModel ready. source={0} services={1} version={2}",
                documentPath.orElse(document.isPresent() ? "classpath:" + CLASSPATH_DOCUMENT : "<empty>"),
                current().services().size(),
                current().version());
    }

    @Override
    public TopologySnapshot current() {
        return current.get();
    }

    @Override
    public TopologySnapshot reload(TopologyDocument document) {
        if (document == null) {
            throw new TopologyException("topology document is required");
        }
        List<ServiceNode> nodes = new ArrayList<>();
        for (var entry : document.services()) {
            nodes.add(toNode(entry));
        }
        TopologySnapshot next;
        TopologySnapshot previous;
        synchronized (versions) {
            next = new TopologySnapshot(versions.incrementAndGet(), nodes);
            previous = current.getAndSet(next);
        }
        LOGGER.infov(
                "[TOPOLOGY-RELOAD] version={0} services={1} previousVersion={2}",
                next.version(),
                next.services().size(),
                previous.version());
        return next;
    }

    private ServiceNode toNode(TopologyDocument.ServiceEntry entry) {
        if (entry == null || entry.name() == null || entry.name().isBlank()) {
            throw new TopologyException("every topology service needs a name");
        }
        Criticality criticality;
        try {
            criticality = Criticality.parse(entry.criticality());
        } catch (IllegalArgumentException e) {
            throw new TopologyException(
                    "invalid criticality '" + entry.criticality() + "' for service " + entry.name(), e);
        }
        var dependencies = new LinkedHashSet<String>();
        Optional.ofNullable(entry.dependencies()).orElse(List.of()).stream()
                .filter(name -> name != null && !name.isBlank())
                .map(String::trim)
                .forEach(dependencies::add);
        var external = new LinkedHashSet<String>();
        Optional.ofNullable(entry.externalDependencies()).orElse(List.of()).stream()
                .filter(name -> name != null && !name.isBlank())
                .forEach(external::add);
        return new ServiceNode(
                entry.name().trim(),
                criticality,
                entry.owner(),
                entry.sla(),
                dependencies,
                external);
    }

    private Optional<TopologyDocument> loadStartupDocument() {
        try {
            if (documentPath.isPresent() && !documentPath.get().isBlank()) {
                try (InputStream in = Files.newInputStream(Path.of(documentPath.get()))) {
                    return Optional.of(mapper.readValue(in, TopologyDocument.class));
                }
            }
            try (InputStream in = Thread.currentThread().getContextClassLoader()
                    .getResourceAsStream(CLASSPATH_DOCUMENT)) {
                if (in == null) {
                    return Optional.empty();
                }
                return Optional.of(mapper.readValue(in, TopologyDocument.class));
            }
        } catch (IOException e) {
            throw new TopologyException("unable to read topology document " + documentPath.orElse(CLASSPATH_DOCUMENT), e);
        }
    }
}
