package com.pennywise.controller;

import com.pennywise.domain.User;
import com.pennywise.dto.ApiResponses;
import com.pennywise.dto.NameRequest;
import com.pennywise.service.CategoryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/categories")
@Tag(name = "Categories", description = "Expense categories")
public class CategoryController {

    private final CategoryService categoryService;

    public CategoryController(CategoryService categoryService) {
        this.categoryService = categoryService;
    }

    @GetMapping
    @Operation(summary = "List categories")
    public ResponseEntity<List<ApiResponses.CategoryResponse>> listCategories(@AuthenticationPrincipal User user) {
        return ResponseEntity.ok(categoryService.listCategories(user.getId())
                .stream()
                .map(ApiResponses.CategoryResponse::new)
                .collect(Collectors.toList()));
    }

    @PostMapping
    @Operation(summary = "Create category")
    public ResponseEntity<ApiResponses.CategoryResponse> createCategory(
            @Valid @RequestBody NameRequest request,
            @AuthenticationPrincipal User user) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new ApiResponses.CategoryResponse(categoryService.createCategory(user.getId(), request.getName())));
    }

    @GetMapping("/{categoryId}")
    @Operation(summary = "Get category")
    public ResponseEntity<ApiResponses.CategoryResponse> getCategory(
            @PathVariable Long categoryId,
            @AuthenticationPrincipal User user) {
        return ResponseEntity.ok(new ApiResponses.CategoryResponse(categoryService.getCategory(user.getId(), categoryId)));
    }

    @PatchMapping("/{categoryId}")
    @Operation(summary = "Rename category")
    public ResponseEntity<ApiResponses.CategoryResponse> renameCategory(
            @PathVariable Long categoryId,
            @Valid @RequestBody NameRequest request,
            @AuthenticationPrincipal User user) {
        return ResponseEntity.ok(new ApiResponses.CategoryResponse(
                categoryService.renameCategory(user.getId(), categoryId, request.getName())));
    }

    @DeleteMapping("/{categoryId}")
    @Operation(summary = "Delete category", description = "Only categories no expense uses")
    public ResponseEntity<Void> deleteCategory(
            @PathVariable Long categoryId,
            @AuthenticationPrincipal User user) {
        categoryService.deleteCategory(user.getId(), categoryId);
        return ResponseEntity.noContent().build();
    }
}
