package com.flagship.wallet_ledger.ledger;

import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Criteria building blocks for statement listing and free-text search.
 */
final class TransactionSpecifications {

    private static final char LIKE_ESCAPE = '\\';

    private TransactionSpecifications() {
    }

    static Specification<TransactionEntity> ownedBy(UUID ownerUserId) {
        return (root, query, cb) -> cb.equal(root.get("ownerUserId"), ownerUserId);
    }

    static Specification<TransactionEntity> matching(TransactionFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (!filter.getTypes().isEmpty()) {
                predicates.add(root.get("type").in(filter.getTypes()));
            }
            if (!filter.getStatuses().isEmpty()) {
                predicates.add(root.get("status").in(filter.getStatuses()));
            }
            if (!filter.getPaymentMethods().isEmpty()) {
                predicates.add(root.get("paymentMethod").in(filter.getPaymentMethods()));
            }
            if (filter.getDirection() != null) {
                predicates.add(cb.equal(root.get("direction"), filter.getDirection()));
            }
            if (filter.getFrom() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("createdAt"), filter.getFrom()));
            }
            if (filter.getTo() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("createdAt"), filter.getTo()));
            }
            if (filter.getMinAmount() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("amount"), filter.getMinAmount()));
            }
            if (filter.getMaxAmount() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("amount"), filter.getMaxAmount()));
            }
            if (filter.getCategory() != null && !filter.getCategory().isBlank()) {
                predicates.add(cb.equal(cb.lower(root.get("category")),
                        filter.getCategory().toLowerCase(Locale.ROOT)));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    /**
     * Case-insensitive substring match over description, remarks, transaction
     * ID, counterpart names and addresses, and category. LIKE wildcards in the
     * query are matched literally.
     */
    static Specification<TransactionEntity> containsText(String text) {
        String pattern = "%" + escapeLike(text.toLowerCase(Locale.ROOT)) + "%";
        return (root, query, cb) -> {
            List<Expression<String>> fields = List.of(
                root.get("description"),
                root.get("remarks"),
                root.get("transactionId"),
                root.get("category"),
                root.get("senderDetails").get("name"),
                root.get("senderDetails").get("upiId"),
                root.get("receiverDetails").get("name"),
                root.get("receiverDetails").get("upiId")
            );
            Predicate[] likes = fields.stream()
                .map(field -> cb.like(cb.lower(field), pattern, LIKE_ESCAPE))
                .toArray(Predicate[]::new);
            return cb.or(likes);
        };
    }

    static String escapeLike(String text) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
