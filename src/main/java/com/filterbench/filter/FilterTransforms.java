package com.filterbench.filter;

import com.filterbench.model.FilterType;
import net.coobird.thumbnailator.filters.ImageFilter;

import java.util.EnumMap;
import java.util.Map;

/**
 * Lookup table from {@link FilterType} to the Thumbnailator filter that
 * implements it.
 *
 * The default kernels follow the classic 3x3/5x5 definitions:
 * BLUR is a 5x5 ring average, CONTOUR and EDGE_DETECT are Laplacian variants,
 * EMBOSS is biased to mid-grey.
 */
public class FilterTransforms {

    private final Map<FilterType, ImageFilter> transforms;

    public FilterTransforms(Map<FilterType, ImageFilter> transforms) {
        this.transforms = new EnumMap<>(FilterType.class);
        this.transforms.putAll(transforms);
    }

    public static FilterTransforms defaults() {
        Map<FilterType, ImageFilter> map = new EnumMap<>(FilterType.class);
        map.put(FilterType.BLUR, new ConvolutionFilter(5, new int[] {
                1, 1, 1, 1, 1,
                1, 0, 0, 0, 1,
                1, 0, 0, 0, 1,
                1, 0, 0, 0, 1,
                1, 1, 1, 1, 1 }, 16, 0));
        map.put(FilterType.GRAYSCALE, new GrayscaleFilter());
        map.put(FilterType.CONTOUR, new ConvolutionFilter(3, new int[] {
                -1, -1, -1,
                -1, 8, -1,
                -1, -1, -1 }, 1, 255));
        map.put(FilterType.EMBOSS, new ConvolutionFilter(3, new int[] {
                -1, 0, 0,
                0, 1, 0,
                0, 0, 0 }, 1, 128));
        map.put(FilterType.SHARPEN, new ConvolutionFilter(3, new int[] {
                -2, -2, -2,
                -2, 32, -2,
                -2, -2, -2 }, 16, 0));
        map.put(FilterType.DETAIL, new ConvolutionFilter(3, new int[] {
                0, -1, 0,
                -1, 10, -1,
                0, -1, 0 }, 6, 0));
        map.put(FilterType.EDGE_DETECT, new ConvolutionFilter(3, new int[] {
                -1, -1, -1,
                -1, 8, -1,
                -1, -1, -1 }, 1, 0));
        return new FilterTransforms(map);
    }

    /**
     * @throws IllegalArgumentException if no transform is registered for the type
     */
    public ImageFilter forType(FilterType type) {
        ImageFilter filter = transforms.get(type);
        if (filter == null) {
            throw new IllegalArgumentException("No transform registered for " + type);
        }
        return filter;
    }

    public boolean supports(FilterType type) {
        return transforms.containsKey(type);
    }
}
