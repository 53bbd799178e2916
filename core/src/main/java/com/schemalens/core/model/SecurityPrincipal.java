package com.schemalens.core.model;

import java.util.Comparator;
import java.util.List;

public record SecurityPrincipal(String name, PrincipalKind kind, List<Grant> grants, List<String> memberOf) {
    public SecurityPrincipal {
        if (name == null || name.isBlank()) {
            throw new ModelIntegrityException("principal", "name is required");
        }
        if (kind == null) {
            throw new ModelIntegrityException("principal " + name, "has no kind");
        }
        grants = grants == null ? List.of() : grants.stream()
                .distinct()
                .sorted(Comparator.comparing((Grant g) -> g.object() == null ? "" : g.object().key())
                        .thenComparing(Grant::privilege))
                .toList();
        memberOf = memberOf == null ? List.of() : memberOf.stream().distinct().sorted().toList();
    }
}
