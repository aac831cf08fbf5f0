package com.williamcallahan.docarchive.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;

/**
 * Single-row table of OCR overrides edited through the UI. Every column is nullable; a
 * {@code null} column defers to the configuration resolver.
 */
@Entity
@Table(name = "ocr_settings")
public class OcrSettingsEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "pages")
    private Integer pages;

    @Column(name = "language", length = 32)
    private String language;

    @Column(name = "output_type", length = 8)
    private String outputType;

    @Column(name = "mode", length = 16)
    private String mode;

    @Column(name = "skip_archive_file", length = 16)
    private String skipArchiveFile;

    @Column(name = "image_dpi")
    private Integer imageDpi;

    @Column(name = "unpaper_clean", length = 16)
    private String unpaperClean;

    @Column(name = "deskew")
    private Boolean deskew;

    @Column(name = "rotate_pages")
    private Boolean rotatePages;

    @Column(name = "rotate_pages_threshold")
    private Double rotatePagesThreshold;

    @Column(name = "max_image_pixels")
    private Double maxImagePixels;

    @Column(name = "color_conversion_strategy", length = 32)
    private String colorConversionStrategy;

    @Lob
    @Column(name = "user_args")
    private String userArgs;

    public Long getId() { return id; }

    public Integer getPages() { return pages; }
    public void setPages(Integer pages) { this.pages = pages; }

    public String getLanguage() { return language; }
    public void setLanguage(String language) { this.language = language; }

    public String getOutputType() { return outputType; }
    public void setOutputType(String outputType) { this.outputType = outputType; }

    public String getMode() { return mode; }
    public void setMode(String mode) { this.mode = mode; }

    public String getSkipArchiveFile() { return skipArchiveFile; }
    public void setSkipArchiveFile(String skipArchiveFile) { this.skipArchiveFile = skipArchiveFile; }

    public Integer getImageDpi() { return imageDpi; }
    public void setImageDpi(Integer imageDpi) { this.imageDpi = imageDpi; }

    public String getUnpaperClean() { return unpaperClean; }
    public void setUnpaperClean(String unpaperClean) { this.unpaperClean = unpaperClean; }

    public Boolean getDeskew() { return deskew; }
    public void setDeskew(Boolean deskew) { this.deskew = deskew; }

    public Boolean getRotatePages() { return rotatePages; }
    public void setRotatePages(Boolean rotatePages) { this.rotatePages = rotatePages; }

    public Double getRotatePagesThreshold() { return rotatePagesThreshold; }
    public void setRotatePagesThreshold(Double rotatePagesThreshold) { this.rotatePagesThreshold = rotatePagesThreshold; }

    public Double getMaxImagePixels() { return maxImagePixels; }
    public void setMaxImagePixels(Double maxImagePixels) { this.maxImagePixels = maxImagePixels; }

    public String getColorConversionStrategy() { return colorConversionStrategy; }
    public void setColorConversionStrategy(String colorConversionStrategy) { this.colorConversionStrategy = colorConversionStrategy; }

    public String getUserArgs() { return userArgs; }
    public void setUserArgs(String userArgs) { this.userArgs = userArgs; }
}
