package mta.eda.receipts.model.receipt;

import static mta.eda.receipts.model.ModelValidation.requirePresent;

public record GenerateOptions(boolean includeImages, GenerationMethod method) {

    public GenerateOptions {
        requirePresent(method, "GenerateOptions.method");
    }

    public static GenerateOptions defaults() {
        return new GenerateOptions(true, GenerationMethod.PRINT);
    }
}
