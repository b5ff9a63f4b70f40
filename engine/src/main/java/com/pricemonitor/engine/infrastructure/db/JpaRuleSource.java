package com.pricemonitor.engine.infrastructure.db;

import static com.pricemonitor.engine.infrastructure.db.StoreExceptionTranslator.translate;

import com.pricemonitor.engine.domain.rule.AlertRule;
import com.pricemonitor.engine.domain.rule.RuleSource;
import com.pricemonitor.engine.infrastructure.db.mapper.AlertRuleRowMapper;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

/**
 * Rules are read fresh for every product group, so edits apply from the next group on.
 * Category and brand matching happens in {@link AlertRule#appliesTo}.
 */
@Repository
@RequiredArgsConstructor
public class JpaRuleSource implements RuleSource {

    private final AlertRuleJpaRepository jpaRepository;
    private final AlertRuleRowMapper mapper;

    @Override
    public List<AlertRule> rulesFor(String productId) {
        return translate("rulesFor", () -> jpaRepository.findCandidates(productId).stream()
                .map(mapper::toDomain)
                .toList());
    }
}
