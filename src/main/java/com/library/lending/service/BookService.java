package com.library.lending.service;

import com.library.lending.dto.request.CreateBookRequest;
import com.library.lending.dto.response.BookResponse;
import com.library.lending.entity.Author;
import com.library.lending.entity.Book;
import com.library.lending.entity.Category;
import com.library.lending.exception.DuplicateIsbnException;
import com.library.lending.exception.InvalidRequestException;
import com.library.lending.exception.ResourceNotFoundException;
import com.library.lending.mapper.BookMapper;
import com.library.lending.repository.AuthorRepository;
import com.library.lending.repository.BookRepository;
import com.library.lending.repository.CategoryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;

@Service
@RequiredArgsConstructor
public class BookService {

    private final BookRepository bookRepository;
    private final AuthorRepository authorRepository;
    private final CategoryRepository categoryRepository;

    @Transactional(readOnly = true)
    public BookResponse findById(Long id) {
        Book book = bookRepository.findByIdWithCategoryAndAuthors(id)
            .orElseThrow(() -> new ResourceNotFoundException("Book", id));
        return BookMapper.toResponse(book);
    }

    /**
     * Adds a title to the catalog. Omitted {@code availableCopies} means every copy is on
     * the shelf. A smaller value is accepted for catalogs whose open loans are loaded
     * separately.
     */
    @Transactional
    public BookResponse create(CreateBookRequest request) {
        int totalCopies = request.totalCopies();
        int availableCopies = request.availableCopies() != null ? request.availableCopies() : totalCopies;
        if (totalCopies < 0 || availableCopies < 0) {
            throw new InvalidRequestException("Copy counts must not be negative");
        }
        if (availableCopies > totalCopies) {
            throw new InvalidRequestException("Available copies (" + availableCopies
                + ") must not exceed total copies (" + totalCopies + ")");
        }

        if (bookRepository.existsByIsbn(request.isbn())) {
            throw new DuplicateIsbnException(request.isbn());
        }

        Category category = null;
        if (request.categoryId() != null) {
            category = categoryRepository.findById(request.categoryId())
                .orElseThrow(() -> new ResourceNotFoundException("Category", request.categoryId()));
        }
        List<Author> authors = resolveAuthors(request.authorIds());

        Book book = BookMapper.toEntity(request, totalCopies, availableCopies);
        book.setCategory(category);
        book.setAuthors(new HashSet<>(authors));
        Book saved = bookRepository.save(book);
        return BookMapper.toResponse(saved);
    }

    private List<Author> resolveAuthors(List<Long> authorIds) {
        if (authorIds == null || authorIds.isEmpty()) {
            return List.of();
        }
        List<Long> distinctIds = List.copyOf(new LinkedHashSet<>(authorIds));
        List<Author> authors = authorRepository.findAllById(distinctIds);
        if (authors.size() != distinctIds.size()) {
            List<Long> foundIds = authors.stream().map(Author::getId).toList();
            Long missingId = distinctIds.stream()
                .filter(id -> !foundIds.contains(id))
                .findFirst()
                .orElseThrow();
            throw new ResourceNotFoundException("Author", missingId);
        }
        return authors;
    }
}
