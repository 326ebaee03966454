package ru.oparin.fpthemes.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Страница витрины публичных тем.
 *
 * @param <T> тип элементов страницы
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageResponseDTO<T> {

    private List<T> content;

    /** Номер страницы, с нуля */
    private Integer page;

    private Integer size;

    private Long totalElements;

    private Integer totalPages;

    private Boolean hasNext;

    private Boolean hasPrevious;

    /**
     * Собрать страницу по общему числу элементов.
     * Пустая витрина дает одну пустую страницу без соседних.
     */
    public static <T> PageResponseDTO<T> of(List<T> content, int page, int size, long totalElements) {
        long pages = size > 0 ? (totalElements + size - 1) / size : 0;
        long shown = (long) page * size + content.size();

        return PageResponseDTO.<T>builder()
                .content(content)
                .page(page)
                .size(size)
                .totalElements(totalElements)
                .totalPages((int) Math.max(pages, 1))
                .hasNext(shown < totalElements)
                .hasPrevious(page > 0)
                .build();
    }
}
