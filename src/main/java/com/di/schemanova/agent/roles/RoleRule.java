package com.di.schemanova.agent.roles;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One entry of the ordered role decision list. The first rule whose predicate accepts
 * the signals assigns its role; the rationale is rendered from the same signals.
 */
record RoleRule(String name, Predicate<RoleSignals> predicate, TableRole role, Function<RoleSignals, String> rationale) {
}
