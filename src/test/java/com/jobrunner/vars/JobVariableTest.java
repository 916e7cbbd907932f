package com.jobrunner.vars;

import com.jobrunner.Fixtures;
import com.jobrunner.core.DomainObject;
import com.jobrunner.core.InMemoryObjectRepository;
import com.jobrunner.core.ObjectNotFoundException;
import com.jobrunner.core.UploadedFile;
import com.jobrunner.core.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Validation, serialization and deserialization of the variable kinds.
 */
public class JobVariableTest {

    private InMemoryObjectRepository objects;
    private Fixtures.CountingFileStorage files;
    private VariableServices services;

    @BeforeEach
    public void setUp() {
        objects = new InMemoryObjectRepository();
        files = new Fixtures.CountingFileStorage();
        services = new VariableServices(objects, files);

        objects.save(new Fixtures.Item("dcim.device", "d1", "edge-1", Map.of("status", "active")));
        objects.save(new Fixtures.Item("dcim.device", "d2", "edge-2", Map.of("status", "planned")));
        objects.save(new Fixtures.Item("dcim.device", "d3", "core-1", Map.of("status", "active")));
    }

    private static String messageOf(ValidationException e) {
        return e.getErrors().get(JobVariable.VALUE_FIELD).get(0);
    }

    @Test
    public void testRequiredValueMissing() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> new StringVar().validate(null, services));
        assertEquals(JobVariable.REQUIRED_MESSAGE, messageOf(e));

        e = assertThrows(ValidationException.class, () -> new StringVar().validate("   ", services));
        assertEquals(JobVariable.REQUIRED_MESSAGE, messageOf(e));
    }

    @Test
    public void testEmptyValueUsesDefault() throws Exception {
        assertEquals("fallback", new StringVar().defaultValue("fallback").validate("", services));
        assertNull(new StringVar().required(false).validate(null, services));
        assertEquals(7, new IntegerVar().defaultValue(7).validate(null, services));
    }

    @Test
    public void testStringConstraints() throws Exception {
        StringVar hostname = new StringVar().minLength(3).maxLength(5).regex("^[a-z]+$");

        assertEquals("edge", hostname.validate("  edge ", services));

        ValidationException tooShort = assertThrows(ValidationException.class, () -> hostname.validate("ab", services));
        assertEquals("Ensure this value has at least 3 characters (it has 2).", messageOf(tooShort));

        ValidationException tooLong = assertThrows(ValidationException.class, () -> hostname.validate("abcdef", services));
        assertEquals("Ensure this value has at most 5 characters (it has 6).", messageOf(tooLong));

        ValidationException noMatch = assertThrows(ValidationException.class, () -> hostname.validate("AB12", services));
        assertEquals("Invalid value. Must match regex: ^[a-z]+$", messageOf(noMatch));
    }

    @Test
    public void testIntegerAcceptsTextAndNumbers() throws Exception {
        IntegerVar count = new IntegerVar().minValue(1).maxValue(10);

        assertEquals(5, count.validate("5", services));
        assertEquals(5, count.validate(5L, services));
        assertEquals(5, count.validate(5.0, services));

        assertEquals("Enter a whole number.",
                messageOf(assertThrows(ValidationException.class, () -> count.validate("5.5", services))));
        assertEquals("Enter a whole number.",
                messageOf(assertThrows(ValidationException.class, () -> count.validate(true, services))));
        assertEquals("Ensure this value is greater than or equal to 1.",
                messageOf(assertThrows(ValidationException.class, () -> count.validate(0, services))));
        assertEquals("Ensure this value is less than or equal to 10.",
                messageOf(assertThrows(ValidationException.class, () -> count.validate(11, services))));
    }

    @Test
    public void testBooleanIsNeverRequired() throws Exception {
        BooleanVar dryRun = new BooleanVar().required(true);

        assertFalse(dryRun.isRequired());
        assertEquals(Boolean.FALSE, dryRun.validate(null, services));
        assertEquals(Boolean.TRUE, dryRun.validate("on", services));
        assertEquals(Boolean.FALSE, dryRun.deserialize(null, services));
        assertThrows(ValidationException.class, () -> dryRun.validate("maybe", services));
    }

    @Test
    public void testChoiceVariables() throws Exception {
        ChoiceVar color = new ChoiceVar().choice("red", "Red").choice("blue", "Blue");
        assertEquals("red", color.validate("red", services));
        assertEquals("Select a valid choice. green is not one of the available choices.",
                messageOf(assertThrows(ValidationException.class, () -> color.validate("green", services))));

        MultiChoiceVar colors = new MultiChoiceVar().choice("red", "Red").choice("blue", "Blue");
        assertEquals(List.of("blue", "red"), colors.validate(List.of("blue", "red"), services));
        assertThrows(ValidationException.class, () -> colors.validate(List.of("red", "green"), services));
        assertThrows(ValidationException.class, () -> colors.validate("red", services));
    }

    @Test
    public void testObjectVarResolvesAndFilters() throws Exception {
        ObjectVar device = new ObjectVar("dcim.device").queryParam("status", "active");

        DomainObject resolved = device.validate("d1", services);
        assertEquals("edge-1", resolved.getDisplay());
        assertEquals("d1", device.serialize(resolved, services));

        // d2 exists but does not match the query
        ValidationException e = assertThrows(ValidationException.class, () -> device.validate("d2", services));
        assertEquals("Select a valid choice. That choice is not one of the available choices.", messageOf(e));

        ValidationException unknownType = assertThrows(ValidationException.class,
                () -> new ObjectVar("dcim.rack").validate("r1", services));
        assertEquals("Unknown object type dcim.rack.", messageOf(unknownType));
    }

    @Test
    public void testObjectVarDeserializesAgainstLiveInventory() throws Exception {
        ObjectVar device = new ObjectVar("dcim.device");

        assertEquals("d3", device.deserialize(Map.of("id", "d3"), services).getId());

        objects.delete("dcim.device", "d3");
        ObjectNotFoundException e = assertThrows(ObjectNotFoundException.class,
                () -> device.deserialize("d3", services));
        assertEquals("dcim.device", e.getObjectType());
        assertEquals(List.of("d3"), e.getMissingIds());
    }

    @Test
    public void testMultiObjectVarKeepsRequestedOrder() throws Exception {
        MultiObjectVar devices = new MultiObjectVar("dcim.device");

        List<DomainObject> resolved = devices.validate(List.of("d3", "d1"), services);
        assertEquals(List.of("d3", "d1"), devices.serialize(resolved, services));

        ValidationException e = assertThrows(ValidationException.class,
                () -> devices.validate(List.of("d1", "d9"), services));
        assertEquals("Select a valid choice. d9 is not one of the available choices.", messageOf(e));

        ObjectNotFoundException missing = assertThrows(ObjectNotFoundException.class,
                () -> devices.deserialize(List.of("d1", "d8", "d9"), services));
        assertEquals(List.of("d8", "d9"), missing.getMissingIds());
    }

    @Test
    public void testListKindsSerializeUncheckedValues() throws Exception {
        MultiObjectVar devices = new MultiObjectVar("dcim.device");
        List<DomainObject> chosen = devices.validate(List.of("d3", "d1"), services);

        assertEquals(List.of("d3", "d1"), devices.serializeUnchecked(chosen, services));
        assertEquals(List.of("red"), new MultiChoiceVar().choice("red", "Red")
                .serializeUnchecked(List.of("red"), services));
        assertThrows(ClassCastException.class, () -> devices.serializeUnchecked(List.of("d1"), services));
        assertThrows(ClassCastException.class, () -> new MultiChoiceVar().serializeUnchecked("red", services));
    }

    @Test
    public void testFileVarStoresOnSerialize() throws Exception {
        FileVar upload = new FileVar();
        UploadedFile file = new UploadedFile("devices.csv", "a,b".getBytes(StandardCharsets.UTF_8));

        UploadedFile validated = upload.validate(file, services);
        Object handle = upload.serialize(validated, services);
        assertTrue(files.contains(handle.toString()));

        UploadedFile loaded = upload.deserialize(handle, services);
        assertEquals(file, loaded);

        assertEquals("The submitted file is empty.", messageOf(assertThrows(ValidationException.class,
                () -> upload.validate(new UploadedFile("empty.csv", new byte[0]), services))));
        assertEquals("No file was submitted. Check the encoding type on the form.",
                messageOf(assertThrows(ValidationException.class, () -> upload.validate("devices.csv", services))));
    }

    @Test
    public void testDescribeListsConstraints() {
        Map<String, Object> described = new StringVar().label("Hostname").maxLength(64).required(false)
                .describe("hostname");

        assertEquals("hostname", described.get("name"));
        assertEquals("StringVar", described.get("type"));
        assertEquals("Hostname", described.get("label"));
        assertEquals(64, described.get("max_length"));
        assertEquals(false, described.get("required"));
    }
}
