package com.vidnyan.uast.adapter.out.rule;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.uast.NormalizerProperties;
import com.vidnyan.uast.application.port.out.RuleTableRepository;
import com.vidnyan.uast.domain.node.Role;
import com.vidnyan.uast.domain.rule.NodePredicate;
import com.vidnyan.uast.domain.rule.Predicates;
import com.vidnyan.uast.domain.rule.Rule;
import com.vidnyan.uast.domain.rule.RuleTable;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rule table repository backed by JSON documents on the classpath.
 * Tables declared in code can be added with {@link #register(RuleTable)}.
 * <p>
 * Document shape:
 * <pre>
 * {"language": "python",
 *  "rule": {"on": {"any": true}, "self": [
 *     {"on": {"not": {"kind": "Module"}}, "error": "root must be of kind Module"},
 *     {"on": {"kind": "Module"}, "roles": ["File", "Module"], "descendants": [ ... ]}]}}
 * </pre>
 * JSON objects carry no key order, so a rule's groups are always applied as
 * {@code self}, then {@code children}, then {@code descendants}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClasspathRuleTableRepository implements RuleTableRepository {

    private final ObjectMapper objectMapper;
    private final NormalizerProperties properties;

    private final Map<String, RuleTable> tables = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadTables() {
        String location = properties.getRulesLocation();
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources(location);

            for (Resource resource : resources) {
                try (InputStream in = resource.getInputStream()) {
                    RuleTable table = read(in);
                    register(table);
                    log.info("Loaded rule table: {} ({} rules) from {}",
                            table.language(), table.size(), resource.getFilename());
                } catch (Exception e) {
                    log.warn("Failed to load rule table from {}: {}", resource.getFilename(), e.getMessage());
                }
            }

            log.info("Loaded {} rule tables from {}", tables.size(), location);
        } catch (IOException e) {
            log.error("Failed to load rule tables from {}", location, e);
        }
    }

    /**
     * Add or replace the table for its language.
     */
    public void register(RuleTable table) {
        RuleTable previous = tables.put(key(table.language()), table);
        if (previous != null) {
            log.info("Replaced rule table for {}", table.language());
        }
    }

    @Override
    public Optional<RuleTable> findByLanguage(String language) {
        if (language == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tables.get(key(language)));
    }

    @Override
    public List<RuleTable> findAll() {
        return List.copyOf(tables.values());
    }

    /**
     * Parse one JSON rule table document.
     */
    RuleTable read(InputStream in) throws IOException {
        RuleTableDto dto = objectMapper.readValue(in, RuleTableDto.class);
        if (dto.language == null || dto.language.isBlank()) {
            throw new IllegalArgumentException("Rule table has no language");
        }
        if (dto.rule == null) {
            throw new IllegalArgumentException("Rule table '" + dto.language + "' has no root rule");
        }
        return new RuleTable(dto.language, mapRule(dto.rule, "rule"));
    }

    private Rule mapRule(RuleDto dto, String path) {
        if (dto.on == null) {
            throw new IllegalArgumentException(path + ": missing 'on'");
        }
        Rule rule = Rule.on(mapPredicate(dto.on, path + ".on"));
        if (dto.error != null) {
            if (notEmpty(dto.roles) || notEmpty(dto.self) || notEmpty(dto.children) || notEmpty(dto.descendants)) {
                throw new IllegalArgumentException(path + ": a rule with 'error' cannot declare roles or nested rules");
            }
            return rule.error(dto.error);
        }
        if (dto.roles != null) {
            rule = rule.roles(dto.roles.stream().map(Role::of).toList());
        }
        if (dto.self != null) {
            rule = rule.self(mapRules(dto.self, path + ".self"));
        }
        if (dto.children != null) {
            rule = rule.children(mapRules(dto.children, path + ".children"));
        }
        if (dto.descendants != null) {
            rule = rule.descendants(mapRules(dto.descendants, path + ".descendants"));
        }
        return rule;
    }

    private Rule[] mapRules(List<RuleDto> dtos, String path) {
        List<Rule> rules = new ArrayList<>(dtos.size());
        for (int i = 0; i < dtos.size(); i++) {
            rules.add(mapRule(dtos.get(i), path + "[" + i + "]"));
        }
        return rules.toArray(new Rule[0]);
    }

    private NodePredicate mapPredicate(PredicateDto dto, String path) {
        List<NodePredicate> forms = new ArrayList<>(1);
        if (Boolean.TRUE.equals(dto.any)) {
            forms.add(Predicates.any());
        }
        if (dto.kind != null) {
            forms.add(Predicates.kind(dto.kind));
        }
        if (dto.fieldRole != null) {
            forms.add(Predicates.fieldRole(dto.fieldRole));
        }
        if (dto.not != null) {
            forms.add(Predicates.not(mapPredicate(dto.not, path + ".not")));
        }
        if (dto.property != null) {
            if (dto.property.name == null) {
                throw new IllegalArgumentException(path + ".property: missing 'name'");
            }
            forms.add(Predicates.property(dto.property.name, dto.property.value));
        }
        if (dto.token != null) {
            forms.add(Predicates.token(dto.token));
        }
        if (dto.hasChild != null) {
            forms.add(Predicates.hasChild(mapPredicate(dto.hasChild, path + ".hasChild")));
        }
        if (forms.size() != 1) {
            throw new IllegalArgumentException(path + ": expected exactly one predicate form, found " + forms.size());
        }
        return forms.get(0);
    }

    private static boolean notEmpty(List<?> list) {
        return list != null && !list.isEmpty();
    }

    private static String key(String language) {
        return language.toLowerCase(Locale.ROOT);
    }

    // DTO classes for JSON deserialization
    static class RuleTableDto {
        public String language;
        public RuleDto rule;
    }

    static class RuleDto {
        public PredicateDto on;
        public List<String> roles;
        public String error;
        public List<RuleDto> self;
        public List<RuleDto> children;
        public List<RuleDto> descendants;
    }

    static class PredicateDto {
        public Boolean any;
        public String kind;
        public String fieldRole;
        public PredicateDto not;
        public PropertyDto property;
        public String token;
        public PredicateDto hasChild;
    }

    static class PropertyDto {
        public String name;
        public String value;
    }
}
