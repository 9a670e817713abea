package com.marketobserver.model;

public record Classification(
        Category category,
        String subCategory
) {
    public Classification {
        category = category == null ? Category.MARKET : category;
        subCategory = subCategory == null || subCategory.isBlank() ? null : subCategory;
    }

    public static Classification market() {
        return new Classification(Category.MARKET, null);
    }
}
