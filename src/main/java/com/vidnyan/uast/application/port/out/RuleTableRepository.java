package com.vidnyan.uast.application.port.out;

import com.vidnyan.uast.domain.rule.RuleTable;

import java.util.List;
import java.util.Optional;

/**
 * Port for looking up language rule tables.
 * Implemented by adapters that read from files, code, etc.
 */
public interface RuleTableRepository {

    /**
     * Find the table for a language id such as {@code python}.
     */
    Optional<RuleTable> findByLanguage(String language);

    /**
     * All registered tables.
     */
    List<RuleTable> findAll();
}
