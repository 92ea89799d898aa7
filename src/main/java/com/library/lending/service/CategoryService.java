package com.library.lending.service;

import com.library.lending.dto.request.CreateCategoryRequest;
import com.library.lending.dto.response.CategoryResponse;
import com.library.lending.exception.DuplicateCategoryException;
import com.library.lending.mapper.CategoryMapper;
import com.library.lending.repository.CategoryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class CategoryService {

    private final CategoryRepository categoryRepository;

    @Transactional(readOnly = true)
    public List<CategoryResponse> findAll() {
        return categoryRepository.findAllByOrderByNameAsc().stream()
            .map(CategoryMapper::toResponse)
            .toList();
    }

    @Transactional
    public CategoryResponse create(CreateCategoryRequest request) {
        if (categoryRepository.existsByNameIgnoreCase(request.name().trim())) {
            throw new DuplicateCategoryException(request.name().trim());
        }
        return CategoryMapper.toResponse(categoryRepository.save(CategoryMapper.toEntity(request)));
    }
}
