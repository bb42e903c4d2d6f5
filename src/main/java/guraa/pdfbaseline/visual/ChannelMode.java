package guraa.pdfbaseline.visual;

/**
 * How multi-channel rasters are reduced before windowed SSIM.
 */
public enum ChannelMode {

    /**
     * SSIM per channel, local maps combined by unweighted mean.
     */
    PER_CHANNEL,

    /**
     * Convert to luminance first (0.299R + 0.587G + 0.114B) and score one plane.
     */
    LUMINANCE
}
