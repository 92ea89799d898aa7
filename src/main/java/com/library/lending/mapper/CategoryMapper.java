package com.library.lending.mapper;

import com.library.lending.dto.request.CreateCategoryRequest;
import com.library.lending.dto.response.CategoryResponse;
import com.library.lending.entity.Category;

public final class CategoryMapper {

    private CategoryMapper() {}

    public static Category toEntity(CreateCategoryRequest request) {
        Category category = new Category();
        category.setName(request.name().trim());
        category.setDescription(request.description());
        return category;
    }

    public static CategoryResponse toResponse(Category category) {
        return new CategoryResponse(
            category.getId(),
            category.getName(),
            category.getDescription(),
            category.getCreatedAt()
        );
    }
}
