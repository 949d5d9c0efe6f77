package io.mersel.services.oscal.application.models;

import io.mersel.services.oscal.application.enums.BaselineLevel;

/**
 * Dönüşüm akışının sonucu.
 * <p>
 * Başarısız durumda {@link #getErrorMessage()} dolu, içerik {@code null}'dır.
 * İçerik dizisi hem oluşturulurken hem okunurken kopyalanır.
 */
public class ConversionResult {

    private final boolean success;
    private final String outputFileName;
    private final byte[] content;
    private final String errorMessage;
    private final BaselineLevel baseline;
    private final int controlCount;

    private ConversionResult(Builder builder) {
        this.success = builder.success;
        this.outputFileName = builder.outputFileName;
        this.content = builder.content == null ? null : builder.content.clone();
        this.errorMessage = builder.errorMessage;
        this.baseline = builder.baseline;
        this.controlCount = builder.controlCount;
    }

    public static ConversionResult failure(String errorMessage) {
        return builder().success(false).errorMessage(errorMessage).build();
    }

    public boolean isSuccess() {
        return success;
    }

    public String getOutputFileName() {
        return outputFileName;
    }

    /** Renderer'ın ürettiği belge içeriği. */
    public byte[] getContent() {
        return content == null ? null : content.clone();
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public BaselineLevel getBaseline() {
        return baseline;
    }

    /** Renderer'a teslim edilen güvenlik kontrolü sayısı. */
    public int getControlCount() {
        return controlCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean success;
        private String outputFileName;
        private byte[] content;
        private String errorMessage;
        private BaselineLevel baseline = BaselineLevel.UNKNOWN;
        private int controlCount;

        private Builder() {
        }

        public Builder success(boolean success) {
            this.success = success;
            return this;
        }

        public Builder outputFileName(String outputFileName) {
            this.outputFileName = outputFileName;
            return this;
        }

        public Builder content(byte[] content) {
            this.content = content;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder baseline(BaselineLevel baseline) {
            this.baseline = baseline;
            return this;
        }

        public Builder controlCount(int controlCount) {
            this.controlCount = controlCount;
            return this;
        }

        public ConversionResult build() {
            return new ConversionResult(this);
        }
    }
}
