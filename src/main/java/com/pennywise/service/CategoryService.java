package com.pennywise.service;

import com.pennywise.domain.Category;
import com.pennywise.domain.User;
import com.pennywise.exception.LedgerValidationException;
import com.pennywise.exception.ResourceNotFoundException;
import com.pennywise.repository.CategoryRepository;
import com.pennywise.repository.ExpenseRepository;
import com.pennywise.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Expense categories. Pure labels, no balance effect.
 */
@Service
@Transactional
public class CategoryService {

    private static final Logger log = LoggerFactory.getLogger(CategoryService.class);

    private final CategoryRepository categoryRepository;
    private final ExpenseRepository expenseRepository;
    private final UserRepository userRepository;
    private final Clock clock;

    public CategoryService(CategoryRepository categoryRepository,
                           ExpenseRepository expenseRepository,
                           UserRepository userRepository,
                           Clock clock) {
        this.categoryRepository = categoryRepository;
        this.expenseRepository = expenseRepository;
        this.userRepository = userRepository;
        this.clock = clock;
    }

    public Category createCategory(Long userId, String name) {
        String trimmed = requireName(name);
        if (categoryRepository.existsByUserIdAndName(userId, trimmed)) {
            throw new LedgerValidationException("name", "Category already exists: " + trimmed);
        }
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));
        Category category = categoryRepository.save(new Category(user, trimmed, clock.instant()));
        log.info("Category created - categoryId={}, userId={}, name={}", category.getId(), userId, trimmed);
        return category;
    }

    @Transactional(readOnly = true)
    public List<Category> listCategories(Long userId) {
        return categoryRepository.findByUserIdOrderByNameAsc(userId);
    }

    @Transactional(readOnly = true)
    public Category getCategory(Long userId, Long categoryId) {
        return categoryRepository.findByIdAndUserId(categoryId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Category", categoryId));
    }

    public Category renameCategory(Long userId, Long categoryId, String name) {
        Category category = getCategory(userId, categoryId);
        String trimmed = requireName(name);
        if (categoryRepository.existsByUserIdAndNameAndIdNot(userId, trimmed, categoryId)) {
            throw new LedgerValidationException("name", "Category already exists: " + trimmed);
        }
        category.rename(trimmed, clock.instant());
        return categoryRepository.save(category);
    }

    /**
     * @throws LedgerValidationException if an expense still uses the category
     */
    public void deleteCategory(Long userId, Long categoryId) {
        Category category = getCategory(userId, categoryId);
        if (expenseRepository.existsByCategoryId(categoryId)) {
            log.warn("Category delete rejected, still referenced - categoryId={}", categoryId);
            throw new LedgerValidationException("Category " + categoryId + " is still used by expenses");
        }
        categoryRepository.delete(category);
        log.info("Category deleted - categoryId={}", categoryId);
    }

    /**
     * Resolve a category referenced by an expense.
     *
     * @throws ResourceNotFoundException if it does not exist
     * @throws LedgerValidationException if it belongs to another user
     */
    @Transactional(readOnly = true)
    public Category resolveOwnedCategory(Long userId, Long categoryId) {
        if (categoryId == null) {
            throw new LedgerValidationException("categoryId", "categoryId is required");
        }
        Category category = categoryRepository.findById(categoryId)
                .orElseThrow(() -> new ResourceNotFoundException("Category", categoryId));
        if (!category.isOwnedBy(userId)) {
            log.warn("Foreign category referenced - userId={}, categoryId={}", userId, categoryId);
            throw new LedgerValidationException("categoryId",
                    "Category " + categoryId + " does not belong to the user");
        }
        return category;
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new LedgerValidationException("name", "name must not be blank");
        }
        String trimmed = name.strip();
        if (trimmed.length() > 64) {
            throw new LedgerValidationException("name", "name must be at most 64 characters");
        }
        return trimmed;
    }
}
