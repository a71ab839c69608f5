package com.codeheadsystems.ledger.dagger;

import com.codeheadsystems.ledger.codec.JsonSegmentCodec;
import com.codeheadsystems.ledger.codec.SealedSegmentCodec;
import com.codeheadsystems.ledger.codec.SegmentCodec;
import com.codeheadsystems.ledger.model.LedgerConfiguration;
import dagger.Module;
import dagger.Provides;
import javax.inject.Provider;
import javax.inject.Singleton;

/**
 * Picks the segment codec from the ledger configuration.
 */
@Module
public class LedgerModule {

  @Provides
  @Singleton
  SegmentCodec segmentCodec(final LedgerConfiguration configuration,
                            final Provider<JsonSegmentCodec> jsonSegmentCodec,
                            final Provider<SealedSegmentCodec> sealedSegmentCodec) {
    return configuration.sealSegments() ? sealedSegmentCodec.get() : jsonSegmentCodec.get();
  }

}
