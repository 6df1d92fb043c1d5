package com.tablescan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Strips grid lines and icons from a located table, leaving a binary image of the text.
 *
 * <p>Each {@link StructurePattern} is isolated by opening the inverted table with its own
 * element: a long thin kernel only fits inside lines of that orientation, a large block only
 * inside solid glyphs. The openings are summed into one mask, grown a little and subtracted
 * from the inverted table. A table without lines yields an empty mask, which leaves the
 * text untouched.
 */
public class StructureRemover {

    private static final Logger log = LoggerFactory.getLogger(StructureRemover.class);

    private final TableScanProperties.Structure settings;
    private final Thresholder thresholder;
    private final Map<StructurePattern, StructuringElement> elements;
    private final StructuringElement maskDilation;
    private final List<ColorFilter> iconFilters;
    private final DebugImageSink debug;

    public StructureRemover(TableScanProperties.Structure settings) {
        this(settings, DebugImageSink.NONE);
    }

    public StructureRemover(TableScanProperties.Structure settings, DebugImageSink debug) {
        if (settings.getMinComponentArea() < 0) {
            throw new IllegalArgumentException("min-component-area cannot be negative: " + settings.getMinComponentArea());
        }
        this.settings = settings;
        this.thresholder = settings.getThreshold().toThresholder();

        Map<StructurePattern, StructuringElement> elements = new EnumMap<>(StructurePattern.class);
        for (Map.Entry<StructurePattern, TableScanProperties.KernelSpec> entry : settings.getKernels().entrySet()) {
            elements.put(entry.getKey(), entry.getValue().toElement());
        }
        this.elements = Collections.unmodifiableMap(elements);
        this.maskDilation = settings.getMaskDilation() == null ? null : settings.getMaskDilation().toElement();

        List<ColorFilter> filters = new ArrayList<>();
        for (String color : settings.getIconColors()) {
            filters.add(settings.getColorMatch().filterFor(color));
        }
        this.iconFilters = Collections.unmodifiableList(filters);
        this.debug = debug;
    }

    public BufferedImage removeStructure(BufferedImage tableImage) throws StructureRemovalFailedException {
        return removeStructure(tableImage, null);
    }

    public BufferedImage removeStructure(BufferedImage tableImage, String imageId) throws StructureRemovalFailedException {
        if (tableImage == null) {
            throw new StructureRemovalFailedException(imageId, "No table image supplied");
        }
        if (tableImage.getWidth() == 0 || tableImage.getHeight() == 0) {
            throw new StructureRemovalFailedException(imageId,
                    "Table image has zero area: " + tableImage.getWidth() + "x" + tableImage.getHeight());
        }

        BufferedImage working = tableImage;
        for (ColorFilter filter : iconFilters) {
            working = filter.paint(working, Color.WHITE);
        }
        if (!iconFilters.isEmpty()) {
            debug.publish(imageId, "structure_icons_painted", working);
        }

        BufferedImage inverted = ImageProcessor.invert(thresholder.threshold(ImageProcessor.toGrayscale(working)));
        debug.publish(imageId, "structure_inverted", inverted);

        try {
            BufferedImage mask = ImageProcessor.blankLike(inverted);
            for (Map.Entry<StructurePattern, StructuringElement> entry : elements.entrySet()) {
                BufferedImage isolated = Morphology.open(inverted, entry.getValue());
                debug.publish(imageId, "structure_" + entry.getKey().name().toLowerCase(), isolated);
                mask = ImageProcessor.add(mask, isolated);
            }

            int structurePixels = ImageProcessor.countForeground(mask);
            if (structurePixels == 0) {
                log.info("No lines or icons detected in {}, keeping the image as is", label(imageId));
            } else if (maskDilation != null) {
                mask = Morphology.dilate(mask, maskDilation);
            }
            debug.publish(imageId, "structure_mask", mask);

            BufferedImage text = ImageProcessor.subtract(inverted, mask);
            if (settings.getMinComponentArea() > 1) {
                text = Morphology.removeSmallComponents(text, settings.getMinComponentArea());
            }
            if (settings.isSmoothStrokes()) {
                text = Morphology.close(text, StructuringElement.block(3));
            }
            debug.publish(imageId, "structure_text", text);

            log.info("Structure removed from {}: {} mask pixels, {} text pixels kept",
                    label(imageId), structurePixels, ImageProcessor.countForeground(text));
            return text;
        } catch (IllegalArgumentException e) {
            throw new StructureRemovalFailedException(imageId, "Intermediate images do not line up: " + e.getMessage(), e);
        }
    }

    private static String label(String imageId) {
        return imageId == null ? "table" : imageId;
    }
}
