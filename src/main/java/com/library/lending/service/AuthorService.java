package com.library.lending.service;

import com.library.lending.dto.request.CreateAuthorRequest;
import com.library.lending.dto.response.AuthorResponse;
import com.library.lending.entity.Author;
import com.library.lending.exception.ResourceNotFoundException;
import com.library.lending.mapper.AuthorMapper;
import com.library.lending.repository.AuthorRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class AuthorService {

    private final AuthorRepository authorRepository;

    @Transactional(readOnly = true)
    public List<AuthorResponse> findAll() {
        return authorRepository.findAllWithBooksOrderedByName().stream()
            .map(AuthorMapper::toResponse)
            .toList();
    }

    @Transactional(readOnly = true)
    public AuthorResponse findById(Long id) {
        Author author = authorRepository.findByIdWithBooks(id)
            .orElseThrow(() -> new ResourceNotFoundException("Author", id));
        return AuthorMapper.toResponse(author);
    }

    @Transactional
    public AuthorResponse create(CreateAuthorRequest request) {
        Author saved = authorRepository.save(AuthorMapper.toEntity(request));
        return AuthorMapper.toResponse(saved);
    }
}
