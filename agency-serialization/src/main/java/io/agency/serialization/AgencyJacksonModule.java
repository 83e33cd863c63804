package io.agency.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.agency.core.workflow.StepAction;
import java.io.Serial;

/// Jackson `SimpleModule` registering the agency type handlers.
///
/// `StepAction` is a sealed hierarchy written with a `"type"` discriminator
/// (`reason`, `tool`, `noop`). Every other snapshot type is a record and binds
/// through its canonical constructor.
///
/// Register it on any mapper that reads step definitions, including the
/// server's request mapper.
///
/// @see SnapshotSerializer for the convenience factory API
public class AgencyJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 4127730581298450113L;

    public AgencyJacksonModule() {
        super("AgencyJacksonModule");

        addSerializer(StepAction.class, new StepActionSerializer());
        addDeserializer(StepAction.class, new StepActionDeserializer());
    }
}
