package com.gpsr.registry.address;

/**
 * Address fields as submitted. On update, null fields keep their current value.
 *
 * @param addressType null for {@link AddressType#REGISTERED} on create
 */
public record AddressInput(
        AddressType addressType,
        String streetLine1,
        String streetLine2,
        String city,
        String postalCode,
        String region,
        String countryCode,
        String sourceId
) {
    public static AddressInput of(String streetLine1, String city, String postalCode, String countryCode) {
        return new AddressInput(null, streetLine1, null, city, postalCode, null, countryCode, null);
    }
}
