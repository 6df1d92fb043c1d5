package com.tablescan;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Tuning knobs of the table pipeline. Field defaults match {@code application.yml}, so a
 * plain {@code new TableScanProperties()} configures the same pipeline as the running service.
 */
@ConfigurationProperties(prefix = "tablescan")
public class TableScanProperties {

    private Locator locator = new Locator();
    private Structure structure = new Structure();
    private Cells cells = new Cells();
    private Recognition recognition = new Recognition();
    private Debug debug = new Debug();

    public Locator getLocator() {
        return locator;
    }

    public void setLocator(Locator locator) {
        this.locator = locator;
    }

    public Structure getStructure() {
        return structure;
    }

    public void setStructure(Structure structure) {
        this.structure = structure;
    }

    public Cells getCells() {
        return cells;
    }

    public void setCells(Cells cells) {
        this.cells = cells;
    }

    public Recognition getRecognition() {
        return recognition;
    }

    public void setRecognition(Recognition recognition) {
        this.recognition = recognition;
    }

    public Debug getDebug() {
        return debug;
    }

    public void setDebug(Debug debug) {
        this.debug = debug;
    }

    public static class Locator {

        /** Binarisation of the photograph. Lighting varies per photo, hence Otsu. */
        private ThresholdSettings threshold = new ThresholdSettings(ThresholdMethod.OTSU, 127);

        /** Passes of a 3x3 dilation closing hairline gaps in the table border. */
        private int dilationIterations = 1;

        /** Contours enclosing less than this share of the photo are ignored. */
        private double minTableAreaRatio = 0.02;

        /** The runner-up contour must be smaller than (1 - margin) x the largest one. */
        private double ambiguityMargin = 0.2;

        /** White border added around the corrected crop, in pixels. */
        private int padding = 20;

        /** Table fill colour (#RRGGBB) painted as ink before thresholding; unset for none. */
        private String backgroundColor;

        private ColorMatch colorMatch = new ColorMatch();

        public ThresholdSettings getThreshold() {
            return threshold;
        }

        public void setThreshold(ThresholdSettings threshold) {
            this.threshold = threshold;
        }

        public int getDilationIterations() {
            return dilationIterations;
        }

        public void setDilationIterations(int dilationIterations) {
            this.dilationIterations = dilationIterations;
        }

        public double getMinTableAreaRatio() {
            return minTableAreaRatio;
        }

        public void setMinTableAreaRatio(double minTableAreaRatio) {
            this.minTableAreaRatio = minTableAreaRatio;
        }

        public double getAmbiguityMargin() {
            return ambiguityMargin;
        }

        public void setAmbiguityMargin(double ambiguityMargin) {
            this.ambiguityMargin = ambiguityMargin;
        }

        public int getPadding() {
            return padding;
        }

        public void setPadding(int padding) {
            this.padding = padding;
        }

        public String getBackgroundColor() {
            return backgroundColor;
        }

        public void setBackgroundColor(String backgroundColor) {
            this.backgroundColor = backgroundColor;
        }

        public ColorMatch getColorMatch() {
            return colorMatch;
        }

        public void setColorMatch(ColorMatch colorMatch) {
            this.colorMatch = colorMatch;
        }
    }

    public static class Structure {

        /** Fixed cutoff: the table is already cropped and evenly lit. */
        private ThresholdSettings threshold = new ThresholdSettings(ThresholdMethod.FIXED, 125);

        /** One opening element per structural pattern. */
        private Map<StructurePattern, KernelSpec> kernels = defaultKernels();

        /** Grows the combined mask over anti-aliased line edges. */
        private KernelSpec maskDilation = new KernelSpec(StructuringElement.Orientation.BLOCK, 3, 3, 1);

        /** Components smaller than this (pixels) are dropped after subtraction. */
        private int minComponentArea = 6;

        /** 3x3 closing that rejoins strokes broken by the subtraction. */
        private boolean smoothStrokes = false;

        /** Icon colours (#RRGGBB) painted as paper before thresholding. */
        private List<String> iconColors = new ArrayList<>();

        private ColorMatch colorMatch = new ColorMatch();

        private static Map<StructurePattern, KernelSpec> defaultKernels() {
            Map<StructurePattern, KernelSpec> kernels = new EnumMap<>(StructurePattern.class);
            kernels.put(StructurePattern.VERTICAL_LINES, new KernelSpec(StructuringElement.Orientation.VERTICAL, 40, 1, 1));
            kernels.put(StructurePattern.HORIZONTAL_LINES, new KernelSpec(StructuringElement.Orientation.HORIZONTAL, 40, 1, 1));
            kernels.put(StructurePattern.ICONS, new KernelSpec(StructuringElement.Orientation.BLOCK, 15, 15, 1));
            return kernels;
        }

        public ThresholdSettings getThreshold() {
            return threshold;
        }

        public void setThreshold(ThresholdSettings threshold) {
            this.threshold = threshold;
        }

        public Map<StructurePattern, KernelSpec> getKernels() {
            return kernels;
        }

        public void setKernels(Map<StructurePattern, KernelSpec> kernels) {
            this.kernels = kernels;
        }

        public KernelSpec getMaskDilation() {
            return maskDilation;
        }

        public void setMaskDilation(KernelSpec maskDilation) {
            this.maskDilation = maskDilation;
        }

        public int getMinComponentArea() {
            return minComponentArea;
        }

        public void setMinComponentArea(int minComponentArea) {
            this.minComponentArea = minComponentArea;
        }

        public boolean isSmoothStrokes() {
            return smoothStrokes;
        }

        public void setSmoothStrokes(boolean smoothStrokes) {
            this.smoothStrokes = smoothStrokes;
        }

        public List<String> getIconColors() {
            return iconColors;
        }

        public void setIconColors(List<String> iconColors) {
            this.iconColors = iconColors;
        }

        public ColorMatch getColorMatch() {
            return colorMatch;
        }

        public void setColorMatch(ColorMatch colorMatch) {
            this.colorMatch = colorMatch;
        }
    }

    public static class Cells {

        /** Applied in order to merge the glyphs of one cell into a single blob. */
        private List<KernelSpec> textDilation = new ArrayList<>(List.of(
                new KernelSpec(StructuringElement.Orientation.HORIZONTAL, 9, 3, 3),
                new KernelSpec(StructuringElement.Orientation.BLOCK, 5, 5, 1)));

        /** Blobs with a smaller box area (pixels) are noise. */
        private int minBoxArea = 50;

        /** Blobs covering more than this share of the image span several cells. */
        private double maxBoxAreaRatio = 0.5;

        /** Blobs lower than this fraction of the mean blob height are line residue. */
        private double minHeightToMeanRatio = 0.5;

        /** Max distance (pixels) between a box centre and its row anchor. Inclusive. */
        private int rowTolerance = 15;

        private TextBoxOrderer.ColumnMode columnMode = TextBoxOrderer.ColumnMode.ROW_ORDINAL;

        /** ALIGNED mode: max distance (pixels) between a left edge and its column band. */
        private int columnTolerance = 30;

        /** ALIGNED mode: number of columns to keep, 0 keeps every band. */
        private int expectedColumns = 0;

        /** Extra pixels around each box when slicing the cell image. */
        private int cellMargin = 2;

        /** Rows missing up to this many cells are padded with empty cells. */
        private int maxPaddedCellsPerRow = 1;

        public List<KernelSpec> getTextDilation() {
            return textDilation;
        }

        public void setTextDilation(List<KernelSpec> textDilation) {
            this.textDilation = textDilation;
        }

        public int getMinBoxArea() {
            return minBoxArea;
        }

        public void setMinBoxArea(int minBoxArea) {
            this.minBoxArea = minBoxArea;
        }

        public double getMaxBoxAreaRatio() {
            return maxBoxAreaRatio;
        }

        public void setMaxBoxAreaRatio(double maxBoxAreaRatio) {
            this.maxBoxAreaRatio = maxBoxAreaRatio;
        }

        public double getMinHeightToMeanRatio() {
            return minHeightToMeanRatio;
        }

        public void setMinHeightToMeanRatio(double minHeightToMeanRatio) {
            this.minHeightToMeanRatio = minHeightToMeanRatio;
        }

        public int getRowTolerance() {
            return rowTolerance;
        }

        public void setRowTolerance(int rowTolerance) {
            this.rowTolerance = rowTolerance;
        }

        public TextBoxOrderer.ColumnMode getColumnMode() {
            return columnMode;
        }

        public void setColumnMode(TextBoxOrderer.ColumnMode columnMode) {
            this.columnMode = columnMode;
        }

        public int getColumnTolerance() {
            return columnTolerance;
        }

        public void setColumnTolerance(int columnTolerance) {
            this.columnTolerance = columnTolerance;
        }

        public int getExpectedColumns() {
            return expectedColumns;
        }

        public void setExpectedColumns(int expectedColumns) {
            this.expectedColumns = expectedColumns;
        }

        public int getCellMargin() {
            return cellMargin;
        }

        public void setCellMargin(int cellMargin) {
            this.cellMargin = cellMargin;
        }

        public int getMaxPaddedCellsPerRow() {
            return maxPaddedCellsPerRow;
        }

        public void setMaxPaddedCellsPerRow(int maxPaddedCellsPerRow) {
            this.maxPaddedCellsPerRow = maxPaddedCellsPerRow;
        }
    }

    public static class Recognition {

        /** Parallel recognition calls across all images. */
        private int threads = 4;

        /** Images processed in parallel by batch and asynchronous requests. */
        private int imageThreads = 2;

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }

        public int getImageThreads() {
            return imageThreads;
        }

        public void setImageThreads(int imageThreads) {
            this.imageThreads = imageThreads;
        }
    }

    public static class Debug {

        /** Where intermediate images are written; unset disables the dump. */
        private String directory;

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }
    }

    public static class ThresholdSettings {

        private ThresholdMethod method = ThresholdMethod.FIXED;

        /** FIXED cutoff, 0-255. */
        private int value = 127;

        /** ADAPTIVE_MEAN window size, odd. */
        private int blockSize = 31;

        /** ADAPTIVE_MEAN offset subtracted from the local mean. */
        private int constant = 10;

        public ThresholdSettings() {
        }

        public ThresholdSettings(ThresholdMethod method, int value) {
            this.method = method;
            this.value = value;
        }

        public Thresholder toThresholder() {
            return Thresholder.create(method, value, blockSize, constant);
        }

        public ThresholdMethod getMethod() {
            return method;
        }

        public void setMethod(ThresholdMethod method) {
            this.method = method;
        }

        public int getValue() {
            return value;
        }

        public void setValue(int value) {
            this.value = value;
        }

        public int getBlockSize() {
            return blockSize;
        }

        public void setBlockSize(int blockSize) {
            this.blockSize = blockSize;
        }

        public int getConstant() {
            return constant;
        }

        public void setConstant(int constant) {
            this.constant = constant;
        }
    }

    public static class KernelSpec {

        private StructuringElement.Orientation orientation = StructuringElement.Orientation.BLOCK;
        private int length = 3;
        private int thickness = 3;
        private int iterations = 1;

        public KernelSpec() {
        }

        public KernelSpec(StructuringElement.Orientation orientation, int length, int thickness, int iterations) {
            this.orientation = orientation;
            this.length = length;
            this.thickness = thickness;
            this.iterations = iterations;
        }

        public StructuringElement toElement() {
            return StructuringElement.of(orientation, length, thickness, iterations);
        }

        public StructuringElement.Orientation getOrientation() {
            return orientation;
        }

        public void setOrientation(StructuringElement.Orientation orientation) {
            this.orientation = orientation;
        }

        public int getLength() {
            return length;
        }

        public void setLength(int length) {
            this.length = length;
        }

        public int getThickness() {
            return thickness;
        }

        public void setThickness(int thickness) {
            this.thickness = thickness;
        }

        public int getIterations() {
            return iterations;
        }

        public void setIterations(int iterations) {
            this.iterations = iterations;
        }
    }

    /** HSV tolerances used by the colour filters. */
    public static class ColorMatch {

        private float hueTolerance = 12f;
        private float minSaturation = 0.3f;
        private float minValue = 0.2f;
        private int closingSize = 5;

        public ColorFilter filterFor(String hexColor) {
            return new ColorFilter(ColorFilter.parseColor(hexColor), hueTolerance, minSaturation, minValue, closingSize);
        }

        public float getHueTolerance() {
            return hueTolerance;
        }

        public void setHueTolerance(float hueTolerance) {
            this.hueTolerance = hueTolerance;
        }

        public float getMinSaturation() {
            return minSaturation;
        }

        public void setMinSaturation(float minSaturation) {
            this.minSaturation = minSaturation;
        }

        public float getMinValue() {
            return minValue;
        }

        public void setMinValue(float minValue) {
            this.minValue = minValue;
        }

        public int getClosingSize() {
            return closingSize;
        }

        public void setClosingSize(int closingSize) {
            this.closingSize = closingSize;
        }
    }
}
