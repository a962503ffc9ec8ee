package mta.eda.receipts.model.order;

import static mta.eda.receipts.model.ModelValidation.orEmpty;
import static mta.eda.receipts.model.ModelValidation.requireText;

/**
 * Store metadata, present only for in-store purchases.
 */
public record StoreInfo(
        String storeNumber,
        String addressLine1,
        String city,
        String state,
        String zipCode
) {

    public StoreInfo {
        requireText(storeNumber, "StoreInfo.storeNumber");
        addressLine1 = orEmpty(addressLine1);
        city = orEmpty(city);
        state = orEmpty(state);
        zipCode = orEmpty(zipCode);
    }
}
