package com.flint.provider.aggregator;

import java.time.LocalDate;
import java.util.List;

public interface AggregatorClient {
  String PROVIDER = "SnapTrade";

  ProviderCredentials registerIdentity(String providerUserId);

  void deleteIdentity(String providerUserId);

  List<AggregatorAccount> listAccounts(ProviderCredentials credentials);

  List<AggregatorAuthorization> listAuthorizations(ProviderCredentials credentials);

  void removeAuthorization(ProviderCredentials credentials, String authorizationId);

  List<AggregatorPosition> listPositions(ProviderCredentials credentials, String accountId);

  List<AggregatorActivity> listActivities(ProviderCredentials credentials,
                                          String accountId,
                                          LocalDate startDate,
                                          LocalDate endDate);

  String connectionPortalUrl(ProviderCredentials credentials);
}
